package io.intellixity.optimade.jdbc.dialect;

import io.intellixity.optimade.entry.SortField;
import io.intellixity.optimade.jdbc.RelationalSchema;
import io.intellixity.optimade.jdbc.SqlPredicate;
import io.intellixity.optimade.jdbc.SqlStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static io.intellixity.optimade.jdbc.RelationalSchema.*;

/**
 * Generic SQL rendering for entry queries.
 * <p>
 * Database-specific dialects override {@link #applyPage} and, where needed, identifier quoting.
 * Rows are loaded with {@code IN (?, ...)} lists bound from the id page.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {

  @Override
  public final SqlStatement selectIds(RelationalSchema schema, SqlPredicate where, List<SortField> sort, int offset, int limit) {
    Objects.requireNonNull(schema, "schema");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(schema.column(schema.idColumn()))
        .append(" FROM ").append(quoteIdent(schema.mainTable())).append(' ').append(MAIN_ALIAS);
    List<Object> binds = appendWhere(sql, where);
    appendOrderBy(sql, schema, sort);
    return new SqlStatement(applyPage(sql.toString(), offset, limit), binds);
  }

  @Override
  public final SqlStatement count(RelationalSchema schema, SqlPredicate where) {
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ")
        .append(quoteIdent(schema.mainTable())).append(' ').append(MAIN_ALIAS);
    List<Object> binds = appendWhere(sql, where);
    return new SqlStatement(sql.toString(), binds);
  }

  @Override
  public SqlStatement loadMainRows(RelationalSchema schema, List<String> ids) {
    String sql = "SELECT * FROM " + quoteIdent(schema.mainTable()) + " " + MAIN_ALIAS
        + " WHERE " + schema.column(schema.idColumn()) + " IN (" + placeholders(ids) + ")";
    return new SqlStatement(sql, new ArrayList<>(ids));
  }

  @Override
  public SqlStatement loadValueRows(String valueTable, List<String> ids) {
    String sql = "SELECT " + OWNER_COLUMN + ", " + KEY_COLUMN + ", " + VALUE_COLUMN
        + " FROM " + quoteIdent(valueTable)
        + " WHERE " + OWNER_COLUMN + " IN (" + placeholders(ids) + ")";
    return new SqlStatement(sql, new ArrayList<>(ids));
  }

  @Override
  public SqlStatement loadListRows(ListTable table, List<String> ids) {
    String sql = "SELECT " + OWNER_COLUMN + ", " + table.column()
        + " FROM " + quoteIdent(table.table())
        + " WHERE " + OWNER_COLUMN + " IN (" + placeholders(ids) + ")";
    return new SqlStatement(sql, new ArrayList<>(ids));
  }

  /** Appends the paging clause; {@code sql} already carries its ORDER BY. */
  protected abstract String applyPage(String sql, int offset, int limit);

  /** Table names are plain identifiers, so the default leaves them unquoted. */
  protected String quoteIdent(String ident) {
    return ident;
  }

  private static List<Object> appendWhere(StringBuilder sql, SqlPredicate where) {
    if (where == null) return List.of();
    sql.append(" WHERE ").append(where.sql());
    return where.binds();
  }

  private static void appendOrderBy(StringBuilder sql, RelationalSchema schema, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> items = new ArrayList<>(sort.size());
    for (SortField s : sort) {
      if (!schema.isSpecial(s.field())) {
        throw new IllegalArgumentException("Sorting on '" + s.field() + "' is not supported; sortable fields are " + schema.specialColumns());
      }
      items.add(schema.column(s.field()) + (s.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    sql.append(" ORDER BY ").append(String.join(", ", items));
  }

  private static String placeholders(List<String> ids) {
    if (ids == null || ids.isEmpty()) throw new IllegalArgumentException("ids must not be empty");
    return String.join(", ", Collections.nCopies(ids.size(), "?"));
  }
}
