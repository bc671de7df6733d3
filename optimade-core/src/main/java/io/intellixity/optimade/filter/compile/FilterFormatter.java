package io.intellixity.optimade.filter.compile;

import io.intellixity.optimade.filter.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link FilterExpression} back to filter text.
 * <p>
 * Output is fully parenthesized and uses double-quoted strings, so compiling it again yields an
 * equal tree. Infinite floats are written as {@code 1E999} / {@code -1E999}.
 */
public final class FilterFormatter implements FilterExpressionVisitor<String> {
  private static final FilterFormatter INSTANCE = new FilterFormatter();

  private FilterFormatter() {}

  public static String format(FilterExpression expression) {
    return Objects.requireNonNull(expression, "expression").accept(INSTANCE);
  }

  @Override
  public String visit(And and) {
    return "(" + and.left().accept(this) + " AND " + and.right().accept(this) + ")";
  }

  @Override
  public String visit(Or or) {
    return "(" + or.left().accept(this) + " OR " + or.right().accept(this) + ")";
  }

  @Override
  public String visit(Not not) {
    return "NOT " + not.inner().accept(this);
  }

  @Override
  public String visit(Comparison c) {
    return c.field() + " " + c.operator().symbol() + " " + value(c.value());
  }

  @Override
  public String visit(SetComparison c) {
    return c.field() + " " + c.quantifier().keyword() + " " + join(c.values(), ", ");
  }

  @Override
  public String visit(LengthComparison c) {
    return c.field() + " LENGTH " + c.operator().symbol() + " " + c.value().value();
  }

  @Override
  public String visit(StringPredicate p) {
    return p.field() + " " + p.kind().keyword() + " " + value(p.value());
  }

  @Override
  public String visit(IsKnown isKnown) {
    return isKnown.field() + " IS KNOWN";
  }

  @Override
  public String visit(CorrelatedComparison c) {
    List<String> fields = new ArrayList<>();
    for (FieldPath f : c.fields()) fields.add(f.dotted());
    List<String> tuples = new ArrayList<>();
    for (ListValue t : c.tuples()) tuples.add(join(t.values(), ":"));
    return String.join(":", fields) + " " + c.quantifier().keyword() + " " + String.join(", ", tuples);
  }

  public static String value(FilterValue v) {
    return switch (v.kind()) {
      case INT -> Long.toString(((IntValue) v).value());
      case FLOAT -> floatText(((FloatValue) v).value());
      case STRING -> quote(((StringValue) v).value());
      case LIST -> join(((ListValue) v).values(), ":");
      case PROPERTY -> ((PropertyValue) v).path().dotted();
    };
  }

  private static String floatText(double d) {
    if (d == Double.POSITIVE_INFINITY) return "1E999";
    if (d == Double.NEGATIVE_INFINITY) return "-1E999";
    return Double.toString(d);
  }

  static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '"' || ch == '\\') sb.append('\\');
      sb.append(ch);
    }
    return sb.append('"').toString();
  }

  private static String join(List<FilterValue> values, String sep) {
    List<String> out = new ArrayList<>(values.size());
    for (FilterValue v : values) out.add(value(v));
    return String.join(sep, out);
  }
}
