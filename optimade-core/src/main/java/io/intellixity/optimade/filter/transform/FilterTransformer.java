package io.intellixity.optimade.filter.transform;

import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.compile.FilterFormatter;

import java.util.Objects;

/**
 * Base class for lowering a normalized filter into a backend predicate {@code P}.
 * <p>
 * Subclasses implement one {@code visit} per node kind. Correlated comparisons are rejected
 * unless a backend overrides {@link #visit(CorrelatedComparison)}. Instances may carry
 * per-request state (e.g. SQL bind lists), so create one per request.
 */
public abstract class FilterTransformer<P> implements FilterExpressionVisitor<P> {
  private final FieldAliases aliases;

  protected FilterTransformer(FieldAliases aliases) {
    this.aliases = (aliases == null) ? FieldAliases.none() : aliases;
  }

  /** Short backend name used in error messages. */
  protected abstract String backend();

  public final FieldAliases aliases() { return aliases; }

  public P transform(FilterExpression expression) {
    return Objects.requireNonNull(expression, "expression").accept(this);
  }

  @Override
  public P visit(CorrelatedComparison comparison) {
    throw notImplemented(comparison, "Correlated comparisons are not supported by the " + backend() + " backend");
  }

  protected final FieldPath backendField(FieldPath field) {
    return aliases.resolve(field);
  }

  protected final String backendPath(FieldPath field) {
    return aliases.resolve(field).dotted();
  }

  /** Backend path of the field holding the length of {@code c.field()}. */
  protected final String lengthPath(LengthComparison c) {
    if (c.operator() == ComparisonOperator.NE) {
      throw notImplemented(c, "LENGTH with != is not supported");
    }
    FieldPath lengthField = aliases.lengthField(c.field())
        .orElseThrow(() -> notImplemented(c, "No length field known for '" + c.field() + "'"));
    return backendPath(lengthField);
  }

  /** Rejects operands that are not plain literals. */
  protected final FilterValue literal(FilterExpression node, FilterValue value) {
    if (value.kind() == FilterValue.Kind.PROPERTY) {
      throw notImplemented(node, "Comparing a property with another property is not supported");
    }
    if (value.kind() == FilterValue.Kind.LIST) {
      throw notImplemented(node, "List operands are not supported here");
    }
    return value;
  }

  protected final String stringArgument(StringPredicate p) {
    if (p.value() instanceof StringValue s) return s.value();
    throw new InvalidFilterException(p.kind().keyword() + " requires a string argument: " + FilterFormatter.format(p));
  }

  protected final NotImplementedFilterException notImplemented(FilterExpression node, String reason) {
    return new NotImplementedFilterException(FilterFormatter.format(node), reason);
  }
}
