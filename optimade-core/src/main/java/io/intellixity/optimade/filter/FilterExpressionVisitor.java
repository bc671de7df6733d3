package io.intellixity.optimade.filter;

public interface FilterExpressionVisitor<R> {
  R visit(And and);
  R visit(Or or);
  R visit(Not not);
  R visit(Comparison comparison);
  R visit(SetComparison comparison);
  R visit(LengthComparison comparison);
  R visit(StringPredicate predicate);
  R visit(IsKnown isKnown);
  R visit(CorrelatedComparison comparison);
}
