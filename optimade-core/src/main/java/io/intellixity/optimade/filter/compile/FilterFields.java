package io.intellixity.optimade.filter.compile;

import io.intellixity.optimade.filter.*;

import java.util.LinkedHashSet;
import java.util.Set;

/** Collects every property path a filter refers to, in first-seen order. */
public final class FilterFields implements FilterExpressionVisitor<Void> {
  private final Set<FieldPath> fields = new LinkedHashSet<>();

  private FilterFields() {}

  public static Set<FieldPath> referenced(FilterExpression expression) {
    if (expression == null) return Set.of();
    FilterFields collector = new FilterFields();
    expression.accept(collector);
    return collector.fields;
  }

  @Override public Void visit(And and) { and.left().accept(this); return and.right().accept(this); }
  @Override public Void visit(Or or) { or.left().accept(this); return or.right().accept(this); }
  @Override public Void visit(Not not) { return not.inner().accept(this); }

  @Override
  public Void visit(Comparison c) {
    fields.add(c.field());
    if (c.value() instanceof PropertyValue p) fields.add(p.path());
    return null;
  }

  @Override public Void visit(SetComparison c) { fields.add(c.field()); return null; }
  @Override public Void visit(LengthComparison c) { fields.add(c.field()); return null; }

  @Override
  public Void visit(StringPredicate p) {
    fields.add(p.field());
    if (p.value() instanceof PropertyValue v) fields.add(v.path());
    return null;
  }

  @Override public Void visit(IsKnown isKnown) { fields.add(isKnown.field()); return null; }
  @Override public Void visit(CorrelatedComparison c) { fields.addAll(c.fields()); return null; }
}
