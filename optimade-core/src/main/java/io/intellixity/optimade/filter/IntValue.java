package io.intellixity.optimade.filter;

public record IntValue(long value) implements NumberValue {
  @Override public Kind kind() { return Kind.INT; }
  @Override public Object raw() { return value; }
  @Override public double doubleValue() { return value; }
}
