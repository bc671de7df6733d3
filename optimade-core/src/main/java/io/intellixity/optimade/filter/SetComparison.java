package io.intellixity.optimade.filter;

import java.util.List;
import java.util.Objects;

/** {@code HAS}, {@code HAS ALL}, {@code HAS ANY} and {@code HAS ONLY} over a list-valued field. */
public record SetComparison(FieldPath field, Quantifier quantifier, List<FilterValue> values) implements FilterExpression {
  public SetComparison {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(quantifier, "quantifier");
    values = List.copyOf(Objects.requireNonNull(values, "values"));
    if (values.isEmpty()) throw new IllegalArgumentException(quantifier + " requires at least one value");
    if (quantifier == Quantifier.HAS && values.size() != 1) {
      throw new IllegalArgumentException("HAS takes exactly one value, got " + values.size());
    }
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
