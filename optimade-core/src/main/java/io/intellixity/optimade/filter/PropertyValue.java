package io.intellixity.optimade.filter;

import java.util.Objects;

/** Right-hand operand naming another property ({@code a < b}). */
public record PropertyValue(FieldPath path) implements FilterValue {
  public PropertyValue {
    Objects.requireNonNull(path, "path");
  }

  @Override public Kind kind() { return Kind.PROPERTY; }
  @Override public Object raw() { return path.dotted(); }
}
