package io.intellixity.optimade.filter;

import java.util.Objects;

/** {@code field LENGTH [op] n}; the field is kept as written, length aliases are resolved per backend. */
public record LengthComparison(FieldPath field, ComparisonOperator operator, IntValue value) implements FilterExpression {
  public LengthComparison {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
