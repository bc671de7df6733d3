package io.intellixity.optimade.jdbc;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RowAssemblerTest {

  private static Map<String, Object> main(String id, Object nelements) {
    Map<String, Object> row = new HashMap<>();
    row.put("id", id);
    row.put("nelements", nelements);
    return row;
  }

  @Test
  void documents_followIdOrder_andRepeatedKeysBecomeLists() {
    RowAssembler a = new RowAssembler(List.of("b", "a"));
    a.mainRow("a", main("a", 1));
    a.mainRow("b", main("b", 2));
    a.valueRow("a", "band_gap", 1.1);
    a.valueRow("b", "tags", "x");
    a.valueRow("b", "tags", "y");
    a.valueRow("b", "tags", "z");
    a.listRow("b", "elements", "O");
    a.listRow("b", "elements", "Si");
    a.listRow("a", "elements", "Ac");

    List<Map<String, Object>> docs = a.documents(Set.of());
    assertEquals(2, docs.size());
    Map<String, Object> b = docs.get(0);
    assertEquals("b", b.get("id"));
    assertEquals(List.of("x", "y", "z"), b.get("tags"));
    assertEquals(List.of("O", "Si"), b.get("elements"));

    Map<String, Object> first = docs.get(1);
    assertEquals(1.1, first.get("band_gap"));
    assertEquals(List.of("Ac"), first.get("elements"));
  }

  @Test
  void nullColumns_andRowsForUnknownIds_areDropped() {
    RowAssembler a = new RowAssembler(List.of("a", "gone"));
    a.mainRow("a", main("a", null));
    a.valueRow("other", "k", 1);
    a.listRow("gone", "elements", "Si");

    List<Map<String, Object>> docs = a.documents(Set.of());
    assertEquals(1, docs.size());
    assertFalse(docs.get(0).containsKey("nelements"));
  }

  @Test
  void projection_keepsOnlyRequestedKeys() {
    RowAssembler a = new RowAssembler(List.of("a"));
    a.mainRow("a", main("a", 3));
    a.valueRow("a", "band_gap", 0.5);

    Map<String, Object> doc = a.documents(Set.of("id", "band_gap")).get(0);
    assertEquals(Set.of("id", "band_gap"), doc.keySet());
  }

  @Test
  void scalarThenListRows_forTheSameField_isRejected() {
    RowAssembler a = new RowAssembler(List.of("a"));
    a.mainRow("a", main("a", 1));
    a.valueRow("a", "elements", "Si");

    JdbcQueryException e = assertThrows(JdbcQueryException.class, () -> a.listRow("a", "elements", "O"));
    assertTrue(e.getMessage().contains("'elements'"), e.getMessage());
  }

  @Test
  void listThenScalarRows_forTheSameField_isRejected() {
    RowAssembler a = new RowAssembler(List.of("a"));
    a.mainRow("a", main("a", 1));
    a.listRow("a", "elements", "Si");

    assertThrows(JdbcQueryException.class, () -> a.valueRow("a", "elements", "O"));
  }
}
