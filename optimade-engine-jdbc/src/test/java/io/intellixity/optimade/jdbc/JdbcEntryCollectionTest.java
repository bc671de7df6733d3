package io.intellixity.optimade.jdbc;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.EntryQuery;
import io.intellixity.optimade.entry.PageLimitExceededException;
import io.intellixity.optimade.filter.NotImplementedFilterException;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.jdbc.dialect.StandardSqlDialect;
import io.intellixity.optimade.spi.exec.PipelineStep;
import io.intellixity.optimade.spi.exec.QueryPipelineException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcEntryCollectionTest {
  private static final FilterCompiler COMPILER = new FilterCompiler(new FilterParser(GrammarRegistry.discover()));

  /** Refuses every connection and counts the attempts. */
  private static final class UnavailableDataSource implements DataSource {
    int connections;

    @Override public Connection getConnection() throws SQLException {
      connections++;
      throw new SQLException("database is down");
    }
    @Override public Connection getConnection(String user, String password) throws SQLException { return getConnection(); }
    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) { }
    @Override public void setLoginTimeout(int seconds) { }
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() throws SQLFeatureNotSupportedException { throw new SQLFeatureNotSupportedException(); }
    @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }

  private static JdbcEntryCollection collection(DataSource ds) {
    return new JdbcEntryCollection("structures", ds, new StandardSqlDialect(), RelationalSchema.structures(),
        COMPILER, RelationalSchema.structuresAliases(), CollectionSettings.defaults().withPageLimits(10, 50));
  }

  @Test
  void pageLimitAboveMax_isForbiddenBeforeDatabase() {
    UnavailableDataSource ds = new UnavailableDataSource();
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> collection(ds).find(EntryQuery.all().withPageLimit(51)));
    assertEquals(403, e.status());
    assertInstanceOf(PageLimitExceededException.class, e.getCause());
    assertEquals(0, ds.connections);
  }

  @Test
  void hasOnly_failsWhileTransforming() {
    UnavailableDataSource ds = new UnavailableDataSource();
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> collection(ds).find(EntryQuery.of("elements HAS ONLY \"Si\"")));
    assertEquals(501, e.status());
    assertEquals(PipelineStep.TRANSFORMED, e.failedStep());
    assertInstanceOf(NotImplementedFilterException.class, e.getCause());
    assertEquals(0, ds.connections);
  }

  @Test
  void sortOnKeyValueField_isBadRequest() {
    UnavailableDataSource ds = new UnavailableDataSource();
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> collection(ds).find(EntryQuery.all().withSort("-band_gap")));
    assertEquals(400, e.status());
    assertEquals(PipelineStep.EXECUTED, e.failedStep());
    assertEquals(0, ds.connections);
  }

  @Test
  void databaseFailure_isServerError() {
    UnavailableDataSource ds = new UnavailableDataSource();
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> collection(ds).count("nelements > 1"));
    assertEquals(500, e.status());
    assertEquals(PipelineStep.EXECUTED, e.failedStep());
    assertInstanceOf(JdbcQueryException.class, e.getCause());
    assertInstanceOf(SQLException.class, e.getCause().getCause());
    assertEquals(1, ds.connections);
  }
}
