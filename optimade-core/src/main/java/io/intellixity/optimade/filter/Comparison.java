package io.intellixity.optimade.filter;

import java.util.Objects;

public record Comparison(FieldPath field, ComparisonOperator operator, FilterValue value) implements FilterExpression {
  public Comparison {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
