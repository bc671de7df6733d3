package io.intellixity.optimade.jdbc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * WHERE-clause fragment over the main table alias {@code s}, with its binds in order.
 * Combining two fragments concatenates their binds left to right.
 */
public record SqlPredicate(String sql, List<Object> binds) {
  public SqlPredicate {
    Objects.requireNonNull(sql, "sql");
    binds = (binds == null) ? List.of() : List.copyOf(binds);
  }

  public static SqlPredicate of(String sql, Object... binds) {
    return new SqlPredicate(sql, List.of(binds));
  }

  public SqlPredicate and(SqlPredicate other) { return join("AND", other); }
  public SqlPredicate or(SqlPredicate other) { return join("OR", other); }

  public SqlPredicate negate() {
    return new SqlPredicate("NOT (" + sql + ")", binds);
  }

  private SqlPredicate join(String op, SqlPredicate other) {
    List<Object> all = new ArrayList<>(binds.size() + other.binds.size());
    all.addAll(binds);
    all.addAll(other.binds);
    return new SqlPredicate("(" + sql + " " + op + " " + other.sql + ")", all);
  }
}
