package io.intellixity.optimade.filter;

import java.util.Objects;

/** {@code field IS KNOWN}; {@code IS UNKNOWN} is expressed as {@code Not(IsKnown)}. */
public record IsKnown(FieldPath field) implements FilterExpression {
  public IsKnown {
    Objects.requireNonNull(field, "field");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
