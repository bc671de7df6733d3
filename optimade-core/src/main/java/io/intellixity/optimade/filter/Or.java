package io.intellixity.optimade.filter;

import java.util.Objects;

public record Or(FilterExpression left, FilterExpression right) implements FilterExpression {
  public Or {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
