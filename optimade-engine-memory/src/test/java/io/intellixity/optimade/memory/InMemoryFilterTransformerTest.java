package io.intellixity.optimade.memory;

import io.intellixity.optimade.filter.NotImplementedFilterException;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import io.intellixity.optimade.filter.transform.FieldAliases;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryFilterTransformerTest {
  private static final FilterCompiler COMPILER = new FilterCompiler(new FilterParser(GrammarRegistry.discover()));
  private static final FieldAliases ALIASES = new FieldAliases(
      Map.of("formula_prototype", "chemical_formula_anonymous"), Map.of("elements", "nelements"));

  private static Predicate<Map<String, Object>> p(String filter) {
    return new InMemoryFilterTransformer(ALIASES).transform(COMPILER.compile(filter));
  }

  private static Map<String, Object> doc(Object... kv) {
    Map<String, Object> d = new HashMap<>();
    for (int i = 0; i < kv.length; i += 2) d.put((String) kv[i], kv[i + 1]);
    return d;
  }

  @Test
  void hasOnly_isExactSetEquality() {
    Map<String, Object> si = doc("elements", List.of("Si"));
    Map<String, Object> siO = doc("elements", List.of("O", "Si"));
    assertFalse(p("elements HAS ONLY \"Si\", \"O\"").test(si));
    assertTrue(p("elements HAS ONLY \"Si\", \"O\"").test(siO));
    assertTrue(p("elements HAS ONLY \"Si\"").test(si));
    assertFalse(p("elements HAS ONLY \"Si\"").test(siO));
  }

  @Test
  void setQuantifiers() {
    Map<String, Object> d = doc("elements", List.of("O", "Si"));
    assertTrue(p("elements HAS \"Si\"").test(d));
    assertTrue(p("elements HAS ALL \"Si\", \"O\"").test(d));
    assertFalse(p("elements HAS ALL \"Si\", \"Al\"").test(d));
    assertTrue(p("elements HAS ANY \"Al\", \"O\"").test(d));
    assertTrue(p("elements = 'O,Si'").test(d));
    assertFalse(p("nelements HAS 1").test(doc("nelements", 1)));
  }

  @Test
  void comparisons_numericAndLexicographic() {
    Map<String, Object> d = doc("nelements", 2, "band_gap", 1.5, "formula", "SiO2");
    assertTrue(p("nelements = 2.0").test(d));
    assertTrue(p("band_gap > 1").test(d));
    assertTrue(p("1 < band_gap").test(d));
    assertTrue(p("formula < \"Z\"").test(d));
    assertFalse(p("formula > 1").test(d));
    assertFalse(p("nelements = \"2\"").test(d));
  }

  @Test
  void scalarComparison_onList_matchesAnyMember() {
    Map<String, Object> d = doc("elements", List.of("O", "Si"), "band_gaps", List.of(0.5, 3.2));
    assertTrue(p("elements = \"Si\"").test(d));
    assertFalse(p("elements = \"Al\"").test(d));
    assertTrue(p("band_gaps > 3").test(d));
    assertFalse(p("band_gaps > 4").test(d));
    assertTrue(p("band_gaps < 1").test(d));
    assertFalse(p("elements != \"Si\"").test(d));
    assertTrue(p("elements != \"Al\"").test(d));
    assertFalse(p("elements > 1").test(d));
  }

  @Test
  void missingValues_neverMatchButNegationDoes() {
    Map<String, Object> d = doc("band_gap", null);
    assertFalse(p("band_gap != 1").test(d));
    assertFalse(p("band_gap = 1").test(d));
    assertTrue(p("NOT band_gap = 1").test(d));
    assertTrue(p("band_gap IS UNKNOWN").test(d));
    assertFalse(p("band_gap IS KNOWN").test(d));
  }

  @Test
  void stringPredicates() {
    Map<String, Object> d = doc("formula", "FeLiO4P");
    assertTrue(p("formula CONTAINS \"LiO\"").test(d));
    assertTrue(p("formula STARTS WITH \"Fe\"").test(d));
    assertTrue(p("formula ENDS \"4P\"").test(d));
    assertFalse(p("formula STARTS \"Li\"").test(d));
  }

  @Test
  void aliasesAndNestedPaths() {
    Map<String, Object> d = doc(
        "chemical_formula_anonymous", "A2B",
        "nelements", 2,
        "species", List.of(Map.of("name", "Si"), Map.of("name", "O")));
    assertTrue(p("formula_prototype = \"A2B\"").test(d));
    assertTrue(p("elements LENGTH 2").test(d));
    assertTrue(p("species.name HAS \"O\"").test(d));
  }

  @Test
  void unsupportedConstructs() {
    assertThrows(NotImplementedFilterException.class, () -> p("species LENGTH 1"));
    assertThrows(NotImplementedFilterException.class, () -> p("elements LENGTH != 1"));
    assertThrows(NotImplementedFilterException.class, () -> p("elements:nsites HAS \"Si\":1"));
    assertThrows(NotImplementedFilterException.class, () -> p("nsites > nelements"));
  }
}
