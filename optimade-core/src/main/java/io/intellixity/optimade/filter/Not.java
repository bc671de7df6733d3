package io.intellixity.optimade.filter;

import java.util.Objects;

public record Not(FilterExpression inner) implements FilterExpression {
  public Not {
    Objects.requireNonNull(inner, "inner");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
