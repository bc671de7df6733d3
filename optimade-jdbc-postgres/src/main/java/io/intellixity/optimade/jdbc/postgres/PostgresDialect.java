package io.intellixity.optimade.jdbc.postgres;

import io.intellixity.optimade.jdbc.dialect.AbstractJdbcSqlDialect;

/**
 * PostgreSQL dialect.
 * <p>
 * Only paging and identifier quoting differ from the generic rendering in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyPage(String sql, int offset, int limit) {
    return sql + " LIMIT " + limit + " OFFSET " + offset;
  }
}
