package io.intellixity.optimade.mongo;

import io.intellixity.optimade.entry.SortField;
import io.intellixity.optimade.spi.exec.BackendQuery;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class MongoQueryPlannerTest {

  @Test
  void planFind_carriesSortPagingAndProjection() {
    MongoQueryPlanner planner = new MongoQueryPlanner("structures");
    BackendQuery q = new BackendQuery(List.of(SortField.desc("nelements"), SortField.asc("task_id")), 4, 2, Set.of("nsites"));
    MongoStatement st = planner.planFind(new Document("nelements", new Document("$gte", 2L)), q);

    assertEquals(MongoStatement.Kind.FIND, st.kind());
    assertEquals("structures", st.collection());
    assertEquals(List.of("nelements", "task_id"), List.copyOf(st.sort().keySet()));
    assertEquals(-1, st.sort().get("nelements"));
    assertEquals(1, st.sort().get("task_id"));
    assertEquals(4, st.skip());
    assertEquals(2, st.limit());
    assertEquals(new Document("nsites", 1), st.projection());
  }

  @Test
  void planFind_nullFilterMatchesAll() {
    MongoStatement st = new MongoQueryPlanner("structures").planFind(null, new BackendQuery(List.of(), 0, 10, Set.of()));
    assertTrue(st.filter().isEmpty());
    assertNull(st.projection());
  }

  @Test
  void planCount_hasNoPaging() {
    MongoStatement st = new MongoQueryPlanner("structures").planCount(new Document("a", 1));
    assertEquals(MongoStatement.Kind.COUNT, st.kind());
    assertNull(st.skip());
    assertNull(st.limit());
  }

  @Test
  void blankCollection_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new MongoQueryPlanner(" "));
  }
}
