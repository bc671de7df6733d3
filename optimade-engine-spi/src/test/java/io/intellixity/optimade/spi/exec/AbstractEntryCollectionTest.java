package io.intellixity.optimade.spi.exec;

import io.intellixity.optimade.entry.*;
import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.compile.FilterFormatter;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractEntryCollectionTest {
  private static final FilterCompiler COMPILER = new FilterCompiler(new FilterParser(GrammarRegistry.discover()));

  /** Renders the filter text; HAS ONLY is treated as unsupported. */
  private static final class TextTransformer extends FilterTransformer<String> {
    TextTransformer(FieldAliases aliases) { super(aliases); }

    @Override protected String backend() { return "fake"; }
    @Override public String visit(And and) { return "(" + and.left().accept(this) + " & " + and.right().accept(this) + ")"; }
    @Override public String visit(Or or) { return "(" + or.left().accept(this) + " | " + or.right().accept(this) + ")"; }
    @Override public String visit(Not not) { return "!" + not.inner().accept(this); }
    @Override public String visit(Comparison c) { return backendPath(c.field()) + c.operator().symbol() + FilterFormatter.value(literal(c, c.value())); }
    @Override public String visit(LengthComparison c) { return lengthPath(c) + c.operator().symbol() + c.value().value(); }
    @Override public String visit(StringPredicate p) { return backendPath(p.field()) + "~" + stringArgument(p); }
    @Override public String visit(IsKnown k) { return backendPath(k.field()) + "?"; }

    @Override
    public String visit(SetComparison c) {
      if (c.quantifier() == Quantifier.HAS_ONLY) throw notImplemented(c, "HAS ONLY is not supported");
      return backendPath(c.field()) + " " + c.quantifier().keyword() + " " + c.values().size();
    }
  }

  /** Pages over a fixed list and ignores the predicate. */
  private static final class FakeCollection extends AbstractEntryCollection<String> {
    final List<Map<String, Object>> docs;
    final List<String> predicates = new ArrayList<>();
    final List<BackendQuery> queries = new ArrayList<>();
    int backendCalls;

    FakeCollection(List<Map<String, Object>> docs, FieldAliases aliases, CollectionSettings settings) {
      super("structures", COMPILER, aliases, settings);
      this.docs = docs;
    }

    @Override protected FilterTransformer<String> newTransformer() { return new TextTransformer(aliases()); }

    @Override
    protected List<Map<String, Object>> executeFind(String predicate, BackendQuery query) {
      backendCalls++;
      predicates.add(predicate);
      queries.add(query);
      int from = Math.min(query.offset(), docs.size());
      int to = Math.min(from + query.limit(), docs.size());
      return docs.subList(from, to);
    }

    @Override
    protected long executeCount(String predicate) {
      backendCalls++;
      return docs.size();
    }
  }

  private static List<Map<String, Object>> docs(int n) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (int i = 1; i <= n; i++) {
      Map<String, Object> d = new LinkedHashMap<>();
      d.put("_id", "oid" + i);
      d.put("task_id", "mpf_" + i);
      d.put("nelements", i);
      out.add(d);
    }
    return out;
  }

  private static FakeCollection collection(int n, CollectionSettings settings) {
    return new FakeCollection(docs(n), FieldAliases.of(Map.of("id", "task_id")), settings);
  }

  @Test
  void find_pagesWithCursors() {
    FakeCollection c = collection(6, CollectionSettings.defaults());
    List<String> ids = new ArrayList<>();
    QueryResultPage page = c.find(EntryQuery.of("nelements > 0").withPageLimit(2));
    int pages = 1;
    ids.addAll(page.ids());
    while (page.moreDataAvailable()) {
      assertEquals(6, page.dataReturned());
      page = c.find(EntryQuery.of("nelements > 0").withPageLimit(2).withCursor(page.nextCursor()));
      ids.addAll(page.ids());
      pages++;
    }
    assertEquals(3, pages);
    assertNull(page.nextCursor());
    assertEquals(List.of("mpf_1", "mpf_2", "mpf_3", "mpf_4", "mpf_5", "mpf_6"), ids);
  }

  @Test
  void find_mapsResourcesAndAliasesFilter() {
    FakeCollection c = collection(1, CollectionSettings.defaults());
    QueryResultPage page = c.find(EntryQuery.of("id = \"mpf_1\"").withSort("-nelements"));

    assertEquals("task_id=\"mpf_1\"", c.predicates.get(0));
    assertEquals(List.of(SortField.desc("nelements"), SortField.asc("task_id")), c.queries.get(0).sort());
    Map<String, Object> entry = page.entries().get(0);
    assertEquals("mpf_1", entry.get("id"));
    assertEquals("structures", entry.get("type"));
    assertEquals(Map.of("nelements", 1), entry.get("attributes"));
  }

  @Test
  void find_blankFilterMatchesAll() {
    FakeCollection c = collection(3, CollectionSettings.defaults());
    QueryResultPage page = c.find(EntryQuery.of("  "));
    assertNull(c.predicates.get(0));
    assertEquals(3, page.entries().size());
    assertFalse(page.moreDataAvailable());
  }

  @Test
  void find_pageLimitAboveMax_isForbiddenBeforeBackend() {
    FakeCollection c = collection(3, CollectionSettings.defaults().withPageLimits(2, 10));
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> c.find(EntryQuery.of("nelements > 0").withPageLimit(11)));
    assertEquals(403, e.status());
    assertEquals(PipelineStep.RECEIVED, e.failedStep());
    assertInstanceOf(PageLimitExceededException.class, e.getCause());
    assertEquals(0, c.backendCalls);
  }

  @Test
  void find_badParameters_areBadRequests() {
    FakeCollection c = collection(3, CollectionSettings.defaults());
    assertEquals(400, assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.all().withPageLimit(0))).status());
    assertEquals(400, assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.all().withPageOffset(-1))).status());
    assertEquals(400, assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.all().withCursor("%%%"))).status());
  }

  @Test
  void find_syntaxError_failsWhileParsing() {
    FakeCollection c = collection(3, CollectionSettings.defaults());
    QueryPipelineException e = assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.of("nelements >")));
    assertEquals(PipelineStep.PARSED, e.failedStep());
    assertEquals(400, e.status());
    assertInstanceOf(FilterSyntaxException.class, e.getCause());
    assertEquals(0, c.backendCalls);
  }

  @Test
  void find_unsupportedConstruct_isNotImplemented() {
    FakeCollection c = collection(3, CollectionSettings.defaults());
    QueryPipelineException e = assertThrows(QueryPipelineException.class,
        () -> c.find(EntryQuery.of("elements HAS ONLY \"Si\"")));
    assertEquals(PipelineStep.TRANSFORMED, e.failedStep());
    assertEquals(501, e.status());
    assertEquals("elements HAS ONLY \"Si\"", ((NotImplementedFilterException) e.getCause()).expression());
  }

  @Test
  void unknownFields_warnByDefault() {
    CollectionSettings settings = CollectionSettings.defaults()
        .withKnownFields(Set.of("id", "type", "nelements"))
        .withProviderPrefix("exmpl");
    FakeCollection c = collection(2, settings);
    QueryResultPage page = c.find(EntryQuery.of("band_gap > 1 AND _exmpl_x = 1 AND _other_y = 2").withResponseFields("nsites"));
    assertEquals(Set.of("band_gap", "_exmpl_x", "_other_y", "nsites"), page.unknownFields());
    assertEquals(2, page.entries().size());
  }

  @Test
  void unknownFields_strictRejectsExceptForeignPrefixes() {
    CollectionSettings settings = CollectionSettings.defaults()
        .withKnownFields(Set.of("id", "type", "nelements"))
        .withProviderPrefix("exmpl")
        .withStrictness(FieldStrictness.STRICT);
    FakeCollection c = collection(2, settings);

    QueryPipelineException e = assertThrows(QueryPipelineException.class, () -> c.find(EntryQuery.of("band_gap > 1")));
    assertEquals(400, e.status());
    assertInstanceOf(InvalidFilterException.class, e.getCause());

    QueryResultPage page = c.find(EntryQuery.of("_other_y = 2"));
    assertEquals(Set.of("_other_y"), page.unknownFields());
  }

  @Test
  void findEntry_singleMatch() {
    FakeCollection c = new FakeCollection(docs(6).subList(2, 3), FieldAliases.of(Map.of("id", "task_id")), CollectionSettings.defaults());
    QueryResultPage page = c.findEntry("mpf_3", EntryQuery.of("nelements = 3"));
    assertEquals(List.of("mpf_3"), page.ids());
    assertFalse(page.moreDataAvailable());
    assertEquals("(task_id=\"mpf_3\" & nelements=3)", c.predicates.get(0));
    assertEquals(2, c.queries.get(0).limit());
  }

  @Test
  void findEntry_duplicateIds_violateInvariant() {
    FakeCollection c = collection(2, CollectionSettings.defaults());
    QueryPipelineException e = assertThrows(QueryPipelineException.class, () -> c.findEntry("mpf_1", null));
    assertEquals(500, e.status());
    assertEquals(PipelineStep.EXECUTED, e.failedStep());
    assertInstanceOf(InvariantViolationException.class, e.getCause());
  }

  @Test
  void count_usesBackendCount() {
    FakeCollection c = collection(4, CollectionSettings.defaults());
    assertEquals(4, c.count("nelements > 0"));
    assertEquals(4, c.count(null));
  }
}
