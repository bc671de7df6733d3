package io.intellixity.optimade.filter;

public sealed interface NumberValue extends FilterValue permits IntValue, FloatValue {
  double doubleValue();
}
