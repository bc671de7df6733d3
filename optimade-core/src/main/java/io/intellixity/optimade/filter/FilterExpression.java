package io.intellixity.optimade.filter;

/**
 * Normalized, backend-independent filter tree.
 * <p>
 * Boolean chains are binary and left-associative; double negation is kept as written.
 */
public sealed interface FilterExpression
    permits And, Or, Not, Comparison, SetComparison, LengthComparison, StringPredicate, IsKnown,
    CorrelatedComparison {

  <R> R accept(FilterExpressionVisitor<R> visitor);
}
