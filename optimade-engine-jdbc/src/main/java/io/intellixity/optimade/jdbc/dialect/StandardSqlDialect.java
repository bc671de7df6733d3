package io.intellixity.optimade.jdbc.dialect;

/**
 * SQL:2008 paging, as understood by H2, Derby, Oracle 12c+ and SQL Server 2012+.
 * <p>
 * The key/value tables use the column names {@code key} and {@code value}, which H2 2.x reserves;
 * open H2 databases with {@code NON_KEYWORDS=KEY,VALUE}.
 */
public final class StandardSqlDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "standard"; }

  @Override
  protected String applyPage(String sql, int offset, int limit) {
    return sql + " OFFSET " + offset + " ROWS FETCH NEXT " + limit + " ROWS ONLY";
  }
}
