package io.intellixity.optimade.mongo;

import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import org.bson.Document;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lowers filters to MongoDB query documents.
 * <p>
 * NOT is rendered as {@code $nor} around the operand. {@code !=} and {@code IS KNOWN} also exclude
 * nulls so that unknown values never match. {@code <type>.id} on a configured related entry type
 * targets {@code relationships.<type>.data.id}.
 */
public final class MongoFilterTransformer extends FilterTransformer<Document> {
  private static final String REGEX_META = "\\^$.|?*+()[]{}";

  private final Set<String> relationshipTypes;

  public MongoFilterTransformer(FieldAliases aliases) {
    this(aliases, Set.of());
  }

  public MongoFilterTransformer(FieldAliases aliases, Set<String> relationshipTypes) {
    super(aliases);
    this.relationshipTypes = Set.copyOf(Objects.requireNonNull(relationshipTypes, "relationshipTypes"));
  }

  @Override
  protected String backend() { return "mongo"; }

  @Override
  public Document visit(And and) {
    return new Document("$and", List.of(and.left().accept(this), and.right().accept(this)));
  }

  @Override
  public Document visit(Or or) {
    return new Document("$or", List.of(or.left().accept(this), or.right().accept(this)));
  }

  @Override
  public Document visit(Not not) {
    return new Document("$nor", List.of(not.inner().accept(this)));
  }

  @Override
  public Document visit(Comparison c) {
    String path = path(c.field());
    Object v = literal(c, c.value()).raw();
    if (c.operator() == ComparisonOperator.NE) {
      return new Document("$and", List.of(
          new Document(path, new Document("$ne", v)),
          new Document(path, new Document("$ne", null))));
    }
    return new Document(path, new Document(operator(c.operator()), v));
  }

  @Override
  public Document visit(SetComparison c) {
    String path = path(c.field());
    List<Object> values = new ArrayList<>(c.values().size());
    for (FilterValue v : c.values()) values.add(literal(c, v).raw());
    return switch (c.quantifier()) {
      case HAS, HAS_ANY -> new Document(path, new Document("$in", values));
      case HAS_ALL -> new Document(path, new Document("$all", values));
      case HAS_ONLY -> {
        List<Object> distinct = List.copyOf(new LinkedHashSet<>(values));
        yield new Document(path, new Document("$all", distinct).append("$size", distinct.size()));
      }
    };
  }

  @Override
  public Document visit(LengthComparison c) {
    return new Document(lengthPath(c), new Document(operator(c.operator()), c.value().value()));
  }

  @Override
  public Document visit(StringPredicate p) {
    String escaped = escapeRegex(stringArgument(p));
    String re = switch (p.kind()) {
      case CONTAINS -> escaped;
      case STARTS_WITH -> "^" + escaped;
      case ENDS_WITH -> escaped + "$";
    };
    return new Document(path(p.field()), new Document("$regex", re));
  }

  @Override
  public Document visit(IsKnown isKnown) {
    String path = path(isKnown.field());
    return new Document("$and", List.of(
        new Document(path, new Document("$exists", true)),
        new Document(path, new Document("$ne", null))));
  }

  private String path(FieldPath field) {
    List<String> s = field.segments();
    if (s.size() == 2 && s.get(1).equals("id") && relationshipTypes.contains(s.get(0))) {
      return "relationships." + s.get(0) + ".data.id";
    }
    return backendPath(field);
  }

  private static String operator(ComparisonOperator op) {
    return switch (op) {
      case EQ -> "$eq";
      case NE -> "$ne";
      case LT -> "$lt";
      case LE -> "$lte";
      case GT -> "$gt";
      case GE -> "$gte";
    };
  }

  static String escapeRegex(String literal) {
    StringBuilder sb = new StringBuilder(literal.length() + 8);
    for (char ch : literal.toCharArray()) {
      if (REGEX_META.indexOf(ch) >= 0) sb.append('\\');
      sb.append(ch);
    }
    return sb.toString();
  }
}
