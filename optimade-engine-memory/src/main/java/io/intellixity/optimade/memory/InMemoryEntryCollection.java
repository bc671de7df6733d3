package io.intellixity.optimade.memory;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.SortField;
import io.intellixity.optimade.filter.FieldPath;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import io.intellixity.optimade.spi.exec.AbstractEntryCollection;
import io.intellixity.optimade.spi.exec.BackendQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/** Entry collection over a fixed list of documents; sorting is stable. */
public final class InMemoryEntryCollection extends AbstractEntryCollection<Predicate<Map<String, Object>>> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEntryCollection.class);

  private final List<Map<String, Object>> documents;

  public InMemoryEntryCollection(String entryType,
                                 List<Map<String, Object>> documents,
                                 FilterCompiler compiler,
                                 FieldAliases aliases,
                                 CollectionSettings settings) {
    super(entryType, compiler, aliases, settings);
    this.documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
    log.info("optimade.memory collection={} documents={}", entryType, this.documents.size());
  }

  public int size() { return documents.size(); }

  @Override
  protected FilterTransformer<Predicate<Map<String, Object>>> newTransformer() {
    return new InMemoryFilterTransformer(aliases());
  }

  @Override
  protected List<Map<String, Object>> executeFind(Predicate<Map<String, Object>> predicate, BackendQuery query) {
    List<Map<String, Object>> matched = new ArrayList<>();
    for (Map<String, Object> doc : documents) {
      if (predicate == null || predicate.test(doc)) matched.add(doc);
    }
    matched.sort(comparator(query.sort()));

    int from = Math.min(query.offset(), matched.size());
    int to = Math.min(from + query.limit(), matched.size());
    List<Map<String, Object>> page = new ArrayList<>(to - from);
    for (Map<String, Object> doc : matched.subList(from, to)) page.add(project(doc, query.projection()));
    return page;
  }

  @Override
  protected long executeCount(Predicate<Map<String, Object>> predicate) {
    if (predicate == null) return documents.size();
    return documents.stream().filter(predicate).count();
  }

  private static Map<String, Object> project(Map<String, Object> doc, Set<String> projection) {
    if (projection.isEmpty()) return doc;
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : doc.entrySet()) {
      if (projection.contains(e.getKey())) out.put(e.getKey(), e.getValue());
    }
    return out;
  }

  /** Missing values sort last; values of different kinds order by kind name. */
  static Comparator<Map<String, Object>> comparator(List<SortField> sort) {
    Comparator<Map<String, Object>> out = (a, b) -> 0;
    for (SortField s : sort) {
      List<String> path = FieldPath.of(s.field()).segments();
      Comparator<Map<String, Object>> byField = (a, b) -> compareValues(DocumentPaths.get(a, path), DocumentPaths.get(b, path));
      if (s.direction() == SortField.Direction.DESC) {
        Comparator<Map<String, Object>> asc = byField;
        byField = (a, b) -> {
          Object x = DocumentPaths.get(a, path);
          Object y = DocumentPaths.get(b, path);
          if (x == null || y == null) return asc.compare(a, b);
          return -asc.compare(a, b);
        };
      }
      out = out.thenComparing(byField);
    }
    return out;
  }

  private static int compareValues(Object x, Object y) {
    if (x == null && y == null) return 0;
    if (x == null) return 1;
    if (y == null) return -1;
    Integer c = DocumentPaths.compare(x, y);
    if (c != null) return c;
    return x.getClass().getSimpleName().compareTo(y.getClass().getSimpleName());
  }
}
