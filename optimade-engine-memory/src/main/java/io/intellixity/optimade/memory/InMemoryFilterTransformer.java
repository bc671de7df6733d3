package io.intellixity.optimade.memory;

import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Lowers filters to predicates over stored documents.
 * <p>
 * Missing and null values never satisfy a comparison, and values of different kinds never compare.
 * A scalar comparison against a list holds when any member satisfies it, and {@code !=} holds when
 * no member equals the value, as MongoDB evaluates array fields. {@code HAS ONLY} is exact set equality.
 */
public final class InMemoryFilterTransformer extends FilterTransformer<Predicate<Map<String, Object>>> {

  public InMemoryFilterTransformer(FieldAliases aliases) {
    super(aliases);
  }

  @Override
  protected String backend() { return "in-memory"; }

  @Override
  public Predicate<Map<String, Object>> visit(And and) {
    return and.left().accept(this).and(and.right().accept(this));
  }

  @Override
  public Predicate<Map<String, Object>> visit(Or or) {
    return or.left().accept(this).or(or.right().accept(this));
  }

  @Override
  public Predicate<Map<String, Object>> visit(Not not) {
    return not.inner().accept(this).negate();
  }

  @Override
  public Predicate<Map<String, Object>> visit(Comparison c) {
    return compareAt(backendField(c.field()).segments(), c.operator(), literal(c, c.value()).raw());
  }

  @Override
  public Predicate<Map<String, Object>> visit(SetComparison c) {
    List<String> path = backendField(c.field()).segments();
    List<Object> values = c.values().stream().map(v -> literal(c, v).raw()).toList();
    Quantifier q = c.quantifier();
    return doc -> {
      if (!(DocumentPaths.get(doc, path) instanceof Collection<?> actual)) return false;
      return switch (q) {
        case HAS, HAS_ALL -> values.stream().allMatch(v -> contains(actual, v));
        case HAS_ANY -> values.stream().anyMatch(v -> contains(actual, v));
        case HAS_ONLY -> values.stream().allMatch(v -> contains(actual, v))
            && actual.stream().allMatch(a -> contains(values, a));
      };
    };
  }

  @Override
  public Predicate<Map<String, Object>> visit(LengthComparison c) {
    return compareAt(List.of(lengthPath(c).split("\\.")), c.operator(), c.value().value());
  }

  @Override
  public Predicate<Map<String, Object>> visit(StringPredicate p) {
    List<String> path = backendField(p.field()).segments();
    String needle = stringArgument(p);
    StringPredicateKind kind = p.kind();
    return doc -> {
      if (!(DocumentPaths.get(doc, path) instanceof String s)) return false;
      return switch (kind) {
        case CONTAINS -> s.contains(needle);
        case STARTS_WITH -> s.startsWith(needle);
        case ENDS_WITH -> s.endsWith(needle);
      };
    };
  }

  @Override
  public Predicate<Map<String, Object>> visit(IsKnown isKnown) {
    List<String> path = backendField(isKnown.field()).segments();
    return doc -> DocumentPaths.get(doc, path) != null;
  }

  private static Predicate<Map<String, Object>> compareAt(List<String> path, ComparisonOperator op, Object expected) {
    return doc -> {
      Object actual = DocumentPaths.get(doc, path);
      if (actual == null) return false;
      if (actual instanceof Collection<?> members) {
        if (op == ComparisonOperator.NE) return !contains(members, expected);
        for (Object m : members) {
          if (m != null && satisfies(m, op, expected)) return true;
        }
        return false;
      }
      return satisfies(actual, op, expected);
    };
  }

  private static boolean satisfies(Object actual, ComparisonOperator op, Object expected) {
    Integer cmp = DocumentPaths.compare(actual, expected);
    if (cmp == null) return false;
    return switch (op) {
      case EQ -> cmp == 0;
      case NE -> cmp != 0;
      case LT -> cmp < 0;
      case LE -> cmp <= 0;
      case GT -> cmp > 0;
      case GE -> cmp >= 0;
    };
  }

  private static boolean contains(Collection<?> haystack, Object needle) {
    for (Object o : haystack) {
      if (DocumentPaths.sameValue(o, needle)) return true;
    }
    return false;
  }
}
