package io.intellixity.optimade.filter;

import java.util.Objects;

public record StringValue(String value) implements FilterValue {
  public StringValue {
    Objects.requireNonNull(value, "value");
  }

  @Override public Kind kind() { return Kind.STRING; }
  @Override public Object raw() { return value; }
}
