package io.intellixity.optimade.filter;

import java.util.List;
import java.util.Objects;

/** {@code a:b HAS "x":"y"} and its ALL/ANY/ONLY forms; each tuple has one value per field. */
public record CorrelatedComparison(List<FieldPath> fields, Quantifier quantifier, List<ListValue> tuples)
    implements FilterExpression {

  public CorrelatedComparison {
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    Objects.requireNonNull(quantifier, "quantifier");
    tuples = List.copyOf(Objects.requireNonNull(tuples, "tuples"));
    if (fields.size() < 2) throw new IllegalArgumentException("correlated comparison needs at least two fields");
    for (ListValue t : tuples) {
      if (t.values().size() != fields.size()) {
        throw new IllegalArgumentException("tuple " + t.raw() + " does not match fields " + fields);
      }
    }
  }

  @Override
  public <R> R accept(FilterExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
