package io.intellixity.optimade.filter;

public record FloatValue(double value) implements NumberValue {
  public FloatValue {
    if (Double.isNaN(value)) throw new IllegalArgumentException("NaN is not a filter value");
  }

  @Override public Kind kind() { return Kind.FLOAT; }
  @Override public Object raw() { return value; }
  @Override public double doubleValue() { return value; }
}
