package io.intellixity.optimade.mongo;

import io.intellixity.optimade.entry.SortField;
import io.intellixity.optimade.spi.exec.BackendQuery;
import org.bson.Document;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Builds find/count statements from a lowered filter and resolved paging parameters. */
public final class MongoQueryPlanner {
  private final String collection;

  public MongoQueryPlanner(String collection) {
    this.collection = Objects.requireNonNull(collection, "collection");
    if (collection.isBlank()) throw new IllegalArgumentException("collection must not be blank");
  }

  public String collection() { return collection; }

  public MongoStatement planFind(Document filter, BackendQuery query) {
    return new MongoStatement(MongoStatement.Kind.FIND, collection, orAll(filter),
        projectionDoc(query.projection()), sortDoc(query.sort()), query.offset(), query.limit());
  }

  public MongoStatement planCount(Document filter) {
    return new MongoStatement(MongoStatement.Kind.COUNT, collection, orAll(filter), null, null, null, null);
  }

  private static Document orAll(Document filter) {
    return (filter == null) ? new Document() : filter;
  }

  static Document sortDoc(List<SortField> sort) {
    Document d = new Document();
    for (SortField s : sort) {
      d.append(s.field(), s.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return d;
  }

  static Document projectionDoc(Set<String> fields) {
    if (fields.isEmpty()) return null;
    Document d = new Document();
    for (String f : fields) d.append(f, 1);
    return d;
  }
}
