package io.intellixity.optimade.jdbc;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import io.intellixity.optimade.jdbc.RelationalSchema.ListTable;
import io.intellixity.optimade.jdbc.dialect.JdbcDialect;
import io.intellixity.optimade.spi.exec.AbstractEntryCollection;
import io.intellixity.optimade.spi.exec.BackendQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/**
 * Entry collection over the relational layout described by a {@link RelationalSchema}.
 * <p>
 * A find first selects the ordered id page, then loads main-table, key/value and list rows for
 * those ids and assembles one document per id. Sorting works on SPECIAL columns only.
 */
public final class JdbcEntryCollection extends AbstractEntryCollection<SqlPredicate> {
  private static final Logger log = LoggerFactory.getLogger(JdbcEntryCollection.class);

  private final DataSource ds;
  private final JdbcDialect dialect;
  private final RelationalSchema schema;

  public JdbcEntryCollection(String entryType,
                             DataSource ds,
                             JdbcDialect dialect,
                             RelationalSchema schema,
                             FilterCompiler compiler,
                             FieldAliases aliases,
                             CollectionSettings settings) {
    super(entryType, compiler, aliases, settings);
    this.ds = Objects.requireNonNull(ds, "ds");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  @Override
  protected FilterTransformer<SqlPredicate> newTransformer() {
    return new RelationalFilterTransformer(schema, aliases());
  }

  @Override
  protected List<Map<String, Object>> executeFind(SqlPredicate predicate, BackendQuery query) {
    SqlStatement idPage = dialect.selectIds(schema, predicate, query.sort(), query.offset(), query.limit());
    try (Connection c = ds.getConnection()) {
      List<String> ids = new ArrayList<>();
      query(c, "select_ids", idPage, 0, rs -> ids.add(rs.getString(1)));
      if (ids.isEmpty()) return List.of();

      RowAssembler rows = new RowAssembler(ids);
      query(c, "load_main", dialect.loadMainRows(schema, ids), 0, rs -> rows.mainRow(rs.getString(schema.idColumn()), columns(rs)));
      for (String table : schema.valueTables()) {
        query(c, "load_values", dialect.loadValueRows(table, ids), 0,
            rs -> rows.valueRow(rs.getString(1), rs.getString(2), rs.getObject(3)));
      }
      for (var e : schema.listFields().entrySet()) {
        String field = e.getKey();
        ListTable t = e.getValue();
        query(c, "load_list", dialect.loadListRows(t, ids), 0, rs -> rows.listRow(rs.getString(1), field, rs.getObject(2)));
      }
      return rows.documents(query.projection());
    } catch (SQLException e) {
      throw new JdbcQueryException("Find on '" + schema.mainTable() + "' failed", e);
    }
  }

  @Override
  protected long executeCount(SqlPredicate predicate) {
    SqlStatement st = dialect.count(schema, predicate);
    int timeoutSeconds = (int) Math.max(1, (settings().countTimeout().toMillis() + 999) / 1000);
    try (Connection c = ds.getConnection()) {
      long[] n = new long[1];
      query(c, "count", st, timeoutSeconds, rs -> n[0] = rs.getLong(1));
      return n[0];
    } catch (SQLException e) {
      throw new JdbcQueryException("Count on '" + schema.mainTable() + "' failed", e);
    }
  }

  @FunctionalInterface
  private interface RowHandler {
    void row(ResultSet rs) throws SQLException;
  }

  private void query(Connection c, String op, SqlStatement st, int timeoutSeconds, RowHandler handler) throws SQLException {
    debugSql(op, st);
    long t0 = System.nanoTime();
    int n = 0;
    try (PreparedStatement ps = c.prepareStatement(st.sql())) {
      if (timeoutSeconds > 0) ps.setQueryTimeout(timeoutSeconds);
      for (int i = 0; i < st.binds().size(); i++) ps.setObject(i + 1, st.binds().get(i));
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          handler.row(rs);
          n++;
        }
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("optimade.jdbc_done op={} rows={} durationMs={}", op, n, (System.nanoTime() - t0) / 1_000_000.0);
    }
  }

  private void debugSql(String op, SqlStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("optimade.jdbc op={} dialect={} bindCount={} sql={}", op, dialect.id(), st.binds().size(), st.sql());
  }

  private static Map<String, Object> columns(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      out.put(md.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
    }
    return out;
  }
}
