package io.intellixity.optimade.jdbc.dialect;

import io.intellixity.optimade.entry.SortField;
import io.intellixity.optimade.jdbc.RelationalSchema;
import io.intellixity.optimade.jdbc.SqlPredicate;
import io.intellixity.optimade.jdbc.SqlStatement;

import java.util.List;

/** Renders the statements an entry query needs against a {@link RelationalSchema}. */
public interface JdbcDialect {
  String id();

  /** Ordered page of ids; a null predicate selects every row. */
  SqlStatement selectIds(RelationalSchema schema, SqlPredicate where, List<SortField> sort, int offset, int limit);

  SqlStatement count(RelationalSchema schema, SqlPredicate where);

  SqlStatement loadMainRows(RelationalSchema schema, List<String> ids);

  /** {@code (structure_id, key, value)} rows of one key/value table. */
  SqlStatement loadValueRows(String valueTable, List<String> ids);

  /** {@code (structure_id, <column>)} rows of one list table. */
  SqlStatement loadListRows(RelationalSchema.ListTable table, List<String> ids);
}
