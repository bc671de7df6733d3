package io.intellixity.optimade.jdbc;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.EntryQuery;
import io.intellixity.optimade.entry.QueryResultPage;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.jdbc.dialect.StandardSqlDialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcEntryCollectionH2Test {
  private static final FilterCompiler COMPILER = new FilterCompiler(new FilterParser(GrammarRegistry.discover()));

  private static JdbcEntryCollection structures;

  @BeforeAll
  static void seed() throws SQLException {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:optimade_structures;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;NON_KEYWORDS=KEY,VALUE");
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE structures (id VARCHAR(32) PRIMARY KEY, type VARCHAR(32), nelements INT, nsites INT,"
          + " chemical_formula_reduced VARCHAR(64))");
      st.execute("CREATE TABLE ints (structure_id VARCHAR(32), key VARCHAR(64), value BIGINT)");
      st.execute("CREATE TABLE floats (structure_id VARCHAR(32), key VARCHAR(64), value DOUBLE PRECISION)");
      st.execute("CREATE TABLE strings (structure_id VARCHAR(32), key VARCHAR(64), value VARCHAR(255))");
      st.execute("CREATE TABLE species (structure_id VARCHAR(32), name VARCHAR(8))");
      st.execute("CREATE TABLE structure_features (structure_id VARCHAR(32), value VARCHAR(32))");

      st.execute("INSERT INTO structures VALUES"
          + " ('s1', 'structures', 2, 3, 'O2Si'),"
          + " ('s2', 'structures', 2, 5, 'Al2O3'),"
          + " ('s3', 'structures', 1, 2, 'Si'),"
          + " ('s4', 'structures', 4, 28, 'FeLiO4P')");
      st.execute("INSERT INTO species VALUES ('s1', 'Si'), ('s1', 'O'), ('s2', 'Al'), ('s2', 'O'), ('s3', 'Si'),"
          + " ('s4', 'Fe'), ('s4', 'Li'), ('s4', 'O'), ('s4', 'P')");
      st.execute("INSERT INTO floats VALUES ('s1', 'band_gap', 5.6), ('s2', 'band_gap', 8.8), ('s3', 'band_gap', 1.1)");
      st.execute("INSERT INTO strings VALUES ('s1', 'tags', 'oxide'), ('s1', 'tags', 'glass')");
      st.execute("INSERT INTO ints VALUES ('s4', 'n_magnetic', 2)");
      st.execute("INSERT INTO structure_features VALUES ('s2', 'disorder')");
    }
    structures = new JdbcEntryCollection("structures", ds, new StandardSqlDialect(), RelationalSchema.structures(),
        COMPILER, RelationalSchema.structuresAliases(), CollectionSettings.defaults().withPageLimits(10, 50));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> attributes(Map<String, Object> resource) {
    return (Map<String, Object>) resource.get("attributes");
  }

  @Test
  void listTableFilter_pagesInIdOrder() {
    QueryResultPage first = structures.find(EntryQuery.of("elements HAS \"O\"").withPageLimit(2));
    assertEquals(List.of("s1", "s2"), first.ids());
    assertEquals(3, first.dataReturned());
    assertTrue(first.moreDataAvailable());

    QueryResultPage second = structures.find(EntryQuery.of("elements HAS \"O\"").withPageLimit(2).withCursor(first.nextCursor()));
    assertEquals(List.of("s4"), second.ids());
    assertFalse(second.moreDataAvailable());
    assertNull(second.nextCursor());
  }

  @Test
  void documents_combineMainValueAndListRows() {
    QueryResultPage page = structures.find(EntryQuery.of("id = \"s1\""));
    assertEquals(1, page.entries().size());
    Map<String, Object> s1 = page.entries().get(0);
    assertEquals("s1", s1.get("id"));
    assertEquals("structures", s1.get("type"));

    Map<String, Object> attrs = attributes(s1);
    assertEquals(2, attrs.get("nelements"));
    assertEquals("O2Si", attrs.get("chemical_formula_reduced"));
    assertEquals(5.6, attrs.get("band_gap"));
    assertEquals(Set.of("oxide", "glass"), new HashSet<>((List<?>) attrs.get("tags")));
    assertEquals(Set.of("Si", "O"), new HashSet<>((List<?>) attrs.get("elements")));
  }

  @Test
  void floatLiteral_searchesTheFloatsTable() {
    assertEquals(List.of("s1", "s2"), structures.find(EntryQuery.of("band_gap > 5.0")).ids());
    // an integer literal selects the ints table, which holds no band gaps
    assertEquals(0, structures.count("band_gap > 5"));
  }

  @Test
  void sortOnSpecialColumn_thenIdTieBreaker() {
    QueryResultPage page = structures.find(EntryQuery.all().withSort("-nelements"));
    assertEquals(List.of("s4", "s1", "s2", "s3"), page.ids());
  }

  @Test
  void stringPredicate_onSpecialColumn() {
    assertEquals(List.of("s1", "s3"), structures.find(EntryQuery.of("chemical_formula_reduced CONTAINS \"Si\"")).ids());
    assertEquals(List.of("s2"), structures.find(EntryQuery.of("chemical_formula_reduced STARTS WITH \"Al\"")).ids());
  }

  @Test
  void isKnown_andListTableMembership() {
    assertEquals(List.of("s1"), structures.find(EntryQuery.of("tags IS KNOWN")).ids());
    assertEquals(List.of("s4"), structures.find(EntryQuery.of("n_magnetic >= 1")).ids());
    assertEquals(List.of("s2"), structures.find(EntryQuery.of("structure_features HAS \"disorder\"")).ids());
  }

  @Test
  void hasAll_andLength() {
    assertEquals(List.of("s1"), structures.find(EntryQuery.of("elements HAS ALL \"Si\", \"O\"")).ids());
    assertEquals(List.of("s4"), structures.find(EntryQuery.of("elements LENGTH 4")).ids());
  }

  @Test
  void count_matchesFind() {
    assertEquals(2, structures.count("nelements = 2"));
    assertEquals(4, structures.count(""));
  }

  @Test
  void responseFields_projectAttributes() {
    Map<String, Object> s3 = structures.find(EntryQuery.of("id = \"s3\"").withResponseFields("elements")).entries().get(0);
    assertEquals(Map.of("elements", List.of("Si")), attributes(s3));
  }

  @Test
  void findEntry_returnsTheSingleMatch() {
    QueryResultPage page = structures.findEntry("s3", EntryQuery.all());
    assertEquals(List.of("s3"), page.ids());
    assertEquals(1, page.dataReturned());
    assertFalse(page.moreDataAvailable());
  }
}
