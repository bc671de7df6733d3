package io.intellixity.optimade.jdbc;

import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import io.intellixity.optimade.jdbc.RelationalSchema.ListTable;
import io.intellixity.optimade.jdbc.RelationalSchema.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.intellixity.optimade.jdbc.RelationalSchema.*;

/**
 * Lowers a filter to a WHERE fragment over {@code structures s}.
 * <p>
 * SPECIAL fields compare on their column. Other fields become {@code s.id IN (...)} sub-selects
 * on the key/value or list tables. Field names only ever reach the SQL text as schema identifiers;
 * user-supplied keys and values are bound.
 * <p>
 * A literal whose kind cannot be stored in the field's declared table never matches and lowers to
 * {@code 1 = 0}. {@code HAS ONLY} has no relational lowering.
 */
public final class RelationalFilterTransformer extends FilterTransformer<SqlPredicate> {
  static final SqlPredicate NEVER = SqlPredicate.of("1 = 0");

  private final RelationalSchema schema;

  public RelationalFilterTransformer(RelationalSchema schema, FieldAliases aliases) {
    super(aliases);
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  protected String backend() { return "relational"; }

  @Override
  public SqlPredicate visit(And node) {
    return node.left().accept(this).and(node.right().accept(this));
  }

  @Override
  public SqlPredicate visit(Or node) {
    return node.left().accept(this).or(node.right().accept(this));
  }

  @Override
  public SqlPredicate visit(Not node) {
    return node.inner().accept(this).negate();
  }

  @Override
  public SqlPredicate visit(Comparison c) {
    FilterValue v = literal(c, c.value());
    return compare(c, key(c, c.field()), c.operator(), v);
  }

  @Override
  public SqlPredicate visit(LengthComparison c) {
    String key = lengthPath(c);
    return compare(c, key, c.operator(), c.value());
  }

  @Override
  public SqlPredicate visit(SetComparison c) {
    if (c.quantifier() == Quantifier.HAS_ONLY) {
      throw notImplemented(c, "HAS ONLY is not supported by the relational backend");
    }
    String key = key(c, c.field());
    SqlPredicate acc = null;
    for (FilterValue raw : c.values()) {
      SqlPredicate next = has(c, key, literal(c, raw));
      if (acc == null) acc = next;
      else acc = (c.quantifier() == Quantifier.HAS_ANY) ? acc.or(next) : acc.and(next);
    }
    return acc;
  }

  @Override
  public SqlPredicate visit(StringPredicate p) {
    String pattern = switch (p.kind()) {
      case CONTAINS -> "%" + escapeLike(stringArgument(p)) + "%";
      case STARTS_WITH -> escapeLike(stringArgument(p)) + "%";
      case ENDS_WITH -> "%" + escapeLike(stringArgument(p));
    };
    String key = key(p, p.field());
    if (schema.listTable(key).isPresent()) {
      throw notImplemented(p, "String matching on list field '" + key + "' is not supported");
    }
    if (schema.isSpecial(key)) {
      if (kindOf(key, ValueKind.STRING) != ValueKind.STRING) return NEVER;
      return SqlPredicate.of(schema.column(key) + " LIKE ? ESCAPE '\\'", pattern);
    }
    if (kindOf(key, ValueKind.STRING) != ValueKind.STRING) return NEVER;
    return valueSubselect(ValueKind.STRING, VALUE_COLUMN + " LIKE ? ESCAPE '\\'", key, pattern);
  }

  @Override
  public SqlPredicate visit(IsKnown k) {
    String key = key(k, k.field());
    if (schema.isSpecial(key)) return SqlPredicate.of(schema.column(key) + " IS NOT NULL");

    Optional<ListTable> list = schema.listTable(key);
    if (list.isPresent()) {
      return SqlPredicate.of(idColumn() + " IN (SELECT " + OWNER_COLUMN + " FROM " + list.get().table() + ")");
    }
    Optional<ValueKind> declared = schema.declaredKind(key);
    if (declared.isPresent()) {
      return SqlPredicate.of(idColumn() + " IN (SELECT " + OWNER_COLUMN + " FROM " + schema.valueTable(declared.get())
          + " WHERE " + KEY_COLUMN + " = ?)", key);
    }
    List<String> parts = new ArrayList<>();
    List<Object> binds = new ArrayList<>();
    for (String table : schema.valueTables()) {
      parts.add("SELECT " + OWNER_COLUMN + " FROM " + table + " WHERE " + KEY_COLUMN + " = ?");
      binds.add(key);
    }
    return new SqlPredicate(idColumn() + " IN (" + String.join(" UNION ", parts) + ")", binds);
  }

  private SqlPredicate compare(FilterExpression node, String key, ComparisonOperator op, FilterValue v) {
    if (schema.listTable(key).isPresent()) {
      throw notImplemented(node, "Scalar comparison on list field '" + key + "' is not supported");
    }
    ValueKind valueKind = valueKind(v);
    ValueKind target = kindOf(key, valueKind);
    if (!compatible(target, valueKind)) return NEVER;

    if (schema.isSpecial(key)) {
      return SqlPredicate.of(schema.column(key) + " " + sqlOperator(op) + " ?", v.raw());
    }
    return valueSubselect(target, VALUE_COLUMN + " " + sqlOperator(op) + " ?", key, v.raw());
  }

  private SqlPredicate has(FilterExpression node, String key, FilterValue v) {
    Optional<ListTable> list = schema.listTable(key);
    if (list.isPresent()) {
      ListTable t = list.get();
      return SqlPredicate.of(idColumn() + " IN (SELECT " + OWNER_COLUMN + " FROM " + t.table()
          + " WHERE " + t.column() + " = ?)", v.raw());
    }
    if (schema.isSpecial(key)) {
      // a scalar column holds a one-member list at most
      return compare(node, key, ComparisonOperator.EQ, v);
    }
    ValueKind valueKind = valueKind(v);
    ValueKind target = kindOf(key, valueKind);
    if (!compatible(target, valueKind)) return NEVER;
    return valueSubselect(target, VALUE_COLUMN + " = ?", key, v.raw());
  }

  private SqlPredicate valueSubselect(ValueKind kind, String valueCondition, String key, Object value) {
    return SqlPredicate.of(idColumn() + " IN (SELECT " + OWNER_COLUMN + " FROM " + schema.valueTable(kind)
        + " WHERE " + KEY_COLUMN + " = ? AND " + valueCondition + ")", key, value);
  }

  private String key(FilterExpression node, FieldPath field) {
    FieldPath resolved = backendField(field);
    if (resolved.isNested()) {
      throw notImplemented(node, "Nested field '" + field + "' is not supported by the relational backend");
    }
    return resolved.first();
  }

  private String idColumn() { return schema.column(schema.idColumn()); }

  private ValueKind kindOf(String key, ValueKind fallback) {
    return schema.declaredKind(key).orElse(fallback);
  }

  private static boolean compatible(ValueKind column, ValueKind value) {
    if (column == value) return true;
    return column != ValueKind.STRING && value != ValueKind.STRING;
  }

  private static ValueKind valueKind(FilterValue v) {
    return switch (v.kind()) {
      case INT -> ValueKind.INT;
      case FLOAT -> ValueKind.FLOAT;
      case STRING -> ValueKind.STRING;
      default -> throw new IllegalStateException("Not a literal: " + v.kind());
    };
  }

  static String sqlOperator(ComparisonOperator op) {
    return (op == ComparisonOperator.NE) ? "<>" : op.symbol();
  }

  /** Escapes {@code \ % _} for a LIKE pattern with {@code ESCAPE '\'}. */
  static String escapeLike(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 4);
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch == '\\' || ch == '%' || ch == '_') sb.append('\\');
      sb.append(ch);
    }
    return sb.toString();
  }
}
