package io.intellixity.optimade.jdbc;

import java.util.List;

/** Rendered SQL with positional {@code ?} binds, in order. */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
    binds = (binds == null) ? List.of() : List.copyOf(binds);
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }
}
