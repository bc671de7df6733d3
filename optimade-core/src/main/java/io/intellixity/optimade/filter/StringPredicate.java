package io.intellixity.optimade.filter;

import java.util.Objects;

public record StringPredicate(FieldPath field, StringPredicateKind kind, FilterValue value) implements FilterExpression {
  public StringPredicate {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
