package io.intellixity.optimade.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.EntryQuery;
import io.intellixity.optimade.entry.QueryResultPage;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.spi.exec.PipelineStep;
import io.intellixity.optimade.spi.exec.QueryPipelineException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryEntryCollectionTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final FilterCompiler COMPILER = new FilterCompiler(new FilterParser(GrammarRegistry.discover()));

  private static List<Map<String, Object>> fixture() throws IOException {
    try (InputStream in = InMemoryEntryCollectionTest.class.getResourceAsStream("/fixtures/structures.json")) {
      assertNotNull(in, "fixtures/structures.json");
      return JSON.readValue(in, new TypeReference<List<Map<String, Object>>>() {});
    }
  }

  private static InMemoryEntryCollection structures(CollectionSettings settings) throws IOException {
    FieldAliases aliases = new FieldAliases(Map.of(), Map.of("elements", "nelements"));
    return new InMemoryEntryCollection("structures", fixture(), COMPILER, aliases, settings);
  }

  @Test
  void find_endToEnd() throws IOException {
    QueryResultPage page = structures(CollectionSettings.defaults()).find(EntryQuery.of("elements HAS \"Ac\" AND nelements=1"));
    assertEquals(List.of("mpf_1"), page.ids());
    assertEquals(1, page.dataReturned());
    assertFalse(page.moreDataAvailable());
  }

  @Test
  void find_pagination_2_2_2() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    EntryQuery q = EntryQuery.of("nelements >= 2").withPageLimit(2);

    List<Integer> sizes = new ArrayList<>();
    List<String> ids = new ArrayList<>();
    QueryResultPage page = c.find(q);
    while (true) {
      sizes.add(page.entries().size());
      ids.addAll(page.ids());
      assertEquals(6, page.dataReturned());
      if (!page.moreDataAvailable()) break;
      assertNotNull(page.nextCursor());
      page = c.find(q.withCursor(page.nextCursor()));
    }
    assertEquals(List.of(2, 2, 2), sizes);
    assertEquals(List.of("mpf_2", "mpf_4", "mpf_5", "mpf_6", "mpf_7", "mpf_8"), ids);
    assertNull(page.nextCursor());
  }

  @Test
  void find_hasOnlyAgainstSingleElementEntries() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    assertEquals(List.of("mpf_2"), c.find(EntryQuery.of("elements HAS ONLY \"Si\", \"O\"")).ids());
    assertEquals(List.of("mpf_3"), c.find(EntryQuery.of("elements HAS ONLY \"Si\"")).ids());
  }

  @Test
  void find_sortDescendingWithIdTieBreaker() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    QueryResultPage page = c.find(EntryQuery.of("nelements <= 2").withSort("-nelements").withPageLimit(3));
    assertEquals(List.of("mpf_2", "mpf_4", "mpf_5"), page.ids());
  }

  @Test
  void find_sortMissingValuesLast() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    QueryResultPage page = c.find(EntryQuery.all().withSort("band_gap"));
    List<String> ids = page.ids();
    assertEquals("mpf_1", ids.get(0));
    assertEquals(List.of("mpf_5", "mpf_8"), ids.subList(6, 8));
  }

  @Test
  void find_responseFieldsProjection() throws IOException {
    QueryResultPage page = structures(CollectionSettings.defaults())
        .find(EntryQuery.of("id = \"mpf_3\"").withResponseFields("nsites,band_gap"));
    Map<String, Object> entry = page.entries().get(0);
    assertEquals("mpf_3", entry.get("id"));
    assertEquals(Map.of("nsites", 2, "band_gap", 1.1), entry.get("attributes"));
  }

  @Test
  void find_pageLimitAboveMax() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults().withPageLimits(2, 4));
    QueryPipelineException e = assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.all().withPageLimit(5)));
    assertEquals(403, e.status());
    assertEquals(PipelineStep.RECEIVED, e.failedStep());
    assertEquals(2, c.find(EntryQuery.all()).entries().size());
  }

  @Test
  void findEntry_byId() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    assertEquals(List.of("mpf_4"), c.findEntry("mpf_4", null).ids());
    assertTrue(c.findEntry("mpf_4", EntryQuery.of("nelements = 3")).entries().isEmpty());
  }

  @Test
  void findEntry_duplicateIdIsInvariantViolation() throws IOException {
    List<Map<String, Object>> docs = new ArrayList<>(fixture());
    docs.add(Map.of("id", "mpf_1", "nelements", 9));
    InMemoryEntryCollection c = new InMemoryEntryCollection("structures", docs, COMPILER, FieldAliases.none(), CollectionSettings.defaults());
    QueryPipelineException e = assertThrows(QueryPipelineException.class, () -> c.findEntry("mpf_1", null));
    assertEquals(500, e.status());
  }

  @Test
  void count() throws IOException {
    InMemoryEntryCollection c = structures(CollectionSettings.defaults());
    assertEquals(8, c.count(""));
    assertEquals(6, c.count("nelements >= 2"));
    assertEquals(2, c.count("elements HAS \"Ac\""));
  }
}
