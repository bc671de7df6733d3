package io.intellixity.optimade.filter.compile;

import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.parse.CstElement;
import io.intellixity.optimade.filter.parse.CstNode;
import io.intellixity.optimade.filter.parse.CstToken;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a filter CST into a {@link FilterExpression}.
 * <p>
 * Works on rule and token names shared by all registered grammar revisions. Leaves are converted
 * to typed values before their parent rule combines them; AND/OR chains fold to the left.
 * Stateless and thread-safe.
 */
public final class FilterNormalizer {

  public FilterExpression normalize(CstNode cst) {
    Objects.requireNonNull(cst, "cst");
    return switch (cst.rule()) {
      case "filter" -> expression(cst.requireNode("expression"));
      case "expression" -> expression(cst);
      case "expressionClause" -> clause(cst);
      case "expressionPhrase" -> phrase(cst);
      case "comparison" -> comparison(cst);
      default -> throw new IllegalArgumentException("Cannot normalize from rule '" + cst.rule() + "'");
    };
  }

  private FilterExpression expression(CstNode n) {
    FilterExpression acc = null;
    for (CstNode clause : n.nodes("expressionClause")) {
      FilterExpression next = clause(clause);
      acc = (acc == null) ? next : new Or(acc, next);
    }
    return requireReduced(acc, n);
  }

  private FilterExpression clause(CstNode n) {
    FilterExpression acc = null;
    for (CstNode phrase : n.nodes("expressionPhrase")) {
      FilterExpression next = phrase(phrase);
      acc = (acc == null) ? next : new And(acc, next);
    }
    return requireReduced(acc, n);
  }

  private FilterExpression phrase(CstNode n) {
    if (n.hasToken("NOT")) return new Not(phrase(n.requireNode("expressionPhrase")));
    var cmp = n.node("comparison");
    if (cmp.isPresent()) return comparison(cmp.get());
    return expression(n.requireNode("expression"));
  }

  private FilterExpression comparison(CstNode n) {
    var constantFirst = n.node("constantFirstComparison");
    if (constantFirst.isPresent()) return constantFirst(constantFirst.get());
    return propertyFirst(n.requireNode("propertyFirstComparison"));
  }

  private FilterExpression constantFirst(CstNode n) {
    // 1 < a  ==>  a > 1
    ComparisonOperator op = operator(n).mirrored();
    FieldPath field = property(n.requireNode("property"));
    return valueComparison(field, op, n.requireNode("constant"));
  }

  private FilterExpression propertyFirst(CstNode n) {
    FieldPath field = property(n.requireNode("property"));
    CstNode rhs = n.nodes().get(1);
    return switch (rhs.rule()) {
      case "valueOpRhs" -> valueComparison(field, operator(rhs), rhs.requireNode("value"));
      case "knownOpRhs" -> rhs.hasToken("KNOWN") ? new IsKnown(field) : new Not(new IsKnown(field));
      case "fuzzyStringOpRhs" -> stringPredicate(field, rhs);
      case "setOpRhs" -> setComparison(field, rhs);
      case "setZipOpRhs" -> correlated(field, rhs);
      case "lengthOpRhs" -> length(field, rhs);
      default -> throw new IllegalStateException("Unexpected comparison rule '" + rhs.rule() + "'");
    };
  }

  private FilterExpression valueComparison(FieldPath field, ComparisonOperator op, CstNode valueOrConstant) {
    List<FilterValue> values = values(valueOrConstant);
    if (values.size() > 1 && op == ComparisonOperator.EQ) {
      // elements='Si,O'
      return new SetComparison(field, Quantifier.HAS_ALL, values);
    }
    return new Comparison(field, op, scalar(valueOrConstant));
  }

  private FilterExpression stringPredicate(FieldPath field, CstNode rhs) {
    StringPredicateKind kind;
    if (rhs.hasToken("CONTAINS")) kind = StringPredicateKind.CONTAINS;
    else if (rhs.hasToken("STARTS")) kind = StringPredicateKind.STARTS_WITH;
    else kind = StringPredicateKind.ENDS_WITH;
    return new StringPredicate(field, kind, scalar(rhs.requireNode("value")));
  }

  private FilterExpression setComparison(FieldPath field, CstNode rhs) {
    var single = rhs.node("value");
    if (single.isPresent()) {
      List<FilterValue> values = values(single.get());
      return values.size() == 1
          ? new SetComparison(field, Quantifier.HAS, values)
          : new SetComparison(field, Quantifier.HAS_ALL, values);
    }
    List<FilterValue> values = new ArrayList<>();
    for (CstNode v : rhs.requireNode("valueList").nodes("value")) values.addAll(values(v));
    return new SetComparison(field, quantifier(rhs), values);
  }

  private FilterExpression correlated(FieldPath first, CstNode rhs) {
    List<FieldPath> fields = new ArrayList<>();
    fields.add(first);
    for (CstNode p : rhs.requireNode("propertyZipAddon").nodes("property")) fields.add(property(p));

    List<ListValue> tuples = new ArrayList<>();
    var single = rhs.node("valueZip");
    if (single.isPresent()) {
      tuples.add(tuple(single.get()));
      return new CorrelatedComparison(fields, Quantifier.HAS, tuples);
    }
    for (CstNode zip : rhs.requireNode("valueZipList").nodes("valueZip")) tuples.add(tuple(zip));
    return new CorrelatedComparison(fields, quantifier(rhs), tuples);
  }

  private ListValue tuple(CstNode valueZip) {
    List<FilterValue> vs = new ArrayList<>();
    for (CstNode v : valueZip.nodes("value")) vs.add(scalar(v));
    return new ListValue(vs);
  }

  private FilterExpression length(FieldPath field, CstNode rhs) {
    ComparisonOperator op = rhs.hasToken("OPERATOR") ? operator(rhs) : ComparisonOperator.EQ;
    FilterValue v = scalar(rhs.requireNode("value"));
    if (!(v instanceof IntValue n) || n.value() < 0) {
      throw new InvalidFilterException("LENGTH requires a non-negative integer, got '" + rhs.requireNode("value").text() + "'");
    }
    return new LengthComparison(field, op, n);
  }

  private static Quantifier quantifier(CstNode rhs) {
    if (rhs.hasToken("ALL")) return Quantifier.HAS_ALL;
    if (rhs.hasToken("ANY")) return Quantifier.HAS_ANY;
    if (rhs.hasToken("ONLY")) return Quantifier.HAS_ONLY;
    return Quantifier.HAS;
  }

  private static ComparisonOperator operator(CstNode n) {
    CstToken t = n.token("OPERATOR").orElseThrow(() -> new IllegalStateException("No operator in '" + n.rule() + "'"));
    return ComparisonOperator.fromSymbol(t.text());
  }

  static FieldPath property(CstNode n) {
    List<String> segments = new ArrayList<>();
    for (CstToken t : n.tokens()) {
      if (t.is("IDENTIFIER")) segments.add(t.text());
    }
    return new FieldPath(segments);
  }

  /** Value of a {@code value} or {@code constant} node, never split. */
  private FilterValue scalar(CstNode n) {
    CstNode inner = n.nodes().get(0);
    return switch (inner.rule()) {
      case "string" -> new StringValue(unescape(stringToken(inner)));
      case "number" -> number(inner.tokens().get(0).text());
      case "property" -> new PropertyValue(property(inner));
      default -> throw new IllegalStateException("Unexpected value rule '" + inner.rule() + "'");
    };
  }

  /** Like {@link #scalar} but expands a single-quoted group {@code 'Si,O'} into its members. */
  private List<FilterValue> values(CstNode n) {
    CstNode inner = n.nodes().get(0);
    if (inner.rule().equals("string") && inner.hasToken("SINGLE_QUOTED")) {
      List<String> parts = splitQuotedGroup(stringToken(inner));
      if (parts.size() > 1) {
        List<FilterValue> out = new ArrayList<>(parts.size());
        for (String p : parts) out.add(new StringValue(p));
        return out;
      }
    }
    return List.of(scalar(n));
  }

  private static CstToken stringToken(CstNode stringNode) {
    for (CstElement c : stringNode.children()) {
      if (c instanceof CstToken t) return t;
    }
    throw new IllegalStateException("Empty string node");
  }

  static NumberValue number(String text) {
    boolean integral = text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0;
    if (integral) {
      try {
        return new IntValue(Long.parseLong(text));
      } catch (NumberFormatException tooLong) {
        return new FloatValue(new BigDecimal(text).doubleValue());
      }
    }
    // Exponent overflow yields +/-Infinity.
    return new FloatValue(Double.parseDouble(text));
  }

  /** Strips the surrounding quotes and resolves backslash escapes. */
  static String unescape(CstToken quoted) {
    String raw = quoted.text();
    return unescapeBody(raw.substring(1, raw.length() - 1));
  }

  private static String unescapeBody(String body) {
    if (body.indexOf('\\') < 0) return body;
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char ch = body.charAt(i);
      if (ch == '\\' && i + 1 < body.length()) ch = body.charAt(++i);
      sb.append(ch);
    }
    return sb.toString();
  }

  /** Splits the body of one single-quoted token on unescaped commas. */
  static List<String> splitQuotedGroup(CstToken quoted) {
    String raw = quoted.text();
    String body = raw.substring(1, raw.length() - 1);
    List<String> out = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < body.length(); i++) {
      char ch = body.charAt(i);
      if (ch == '\\') {
        i++;
      } else if (ch == ',') {
        out.add(groupMember(body.substring(start, i), raw));
        start = i + 1;
      }
    }
    if (out.isEmpty()) return List.of(unescapeBody(body));
    out.add(groupMember(body.substring(start), raw));
    return out;
  }

  private static String groupMember(String part, String raw) {
    String v = unescapeBody(part.trim());
    if (v.isEmpty()) throw new InvalidFilterException("Empty value in multi-value string " + raw);
    return v;
  }

  private static FilterExpression requireReduced(FilterExpression e, CstNode n) {
    if (e == null) throw new IllegalStateException("Rule '" + n.rule() + "' produced no expression");
    return e;
  }
}
