package io.intellixity.optimade.jdbc;

import java.util.*;

/**
 * Builds stored documents from main-table rows plus key/value and list rows.
 * A key seen more than once for the same entry becomes a list, in row order. A field fed by both
 * key/value rows and list rows raises {@link JdbcQueryException}.
 */
final class RowAssembler {
  private final Map<String, Map<String, Object>> docs = new LinkedHashMap<>();

  /** Fixes the document order to {@code ids}. */
  RowAssembler(List<String> ids) {
    for (String id : ids) docs.put(id, null);
  }

  void mainRow(String id, Map<String, Object> columns) {
    Map<String, Object> doc = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      if (e.getValue() != null) doc.put(e.getKey(), e.getValue());
    }
    docs.put(id, doc);
  }

  void valueRow(String id, String key, Object value) {
    Map<String, Object> doc = docs.get(id);
    if (doc == null || value == null) return;
    Object prev = doc.get(key);
    if (prev == null) {
      doc.put(key, value);
    } else if (prev instanceof ListField) {
      throw conflict(id, key);
    } else if (prev instanceof MultiValue mv) {
      mv.add(value);
    } else {
      MultiValue many = new MultiValue();
      many.add(prev);
      many.add(value);
      doc.put(key, many);
    }
  }

  void listRow(String id, String field, Object value) {
    Map<String, Object> doc = docs.get(id);
    if (doc == null || value == null) return;
    Object prev = doc.get(field);
    if (prev == null) {
      ListField list = new ListField();
      list.add(value);
      doc.put(field, list);
    } else if (prev instanceof ListField list) {
      list.add(value);
    } else {
      throw conflict(id, field);
    }
  }

  private static JdbcQueryException conflict(String id, String field) {
    return new JdbcQueryException("Field '" + field + "' of entry '" + id + "' is stored both as a key/value row and in a list table");
  }

  /** Documents in id order, projected when {@code projection} is non-empty; ids without a main row are skipped. */
  List<Map<String, Object>> documents(Set<String> projection) {
    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Map<String, Object> doc : docs.values()) {
      if (doc == null) continue;
      Map<String, Object> d = new LinkedHashMap<>();
      for (var e : doc.entrySet()) {
        if (!projection.isEmpty() && !projection.contains(e.getKey())) continue;
        Object v = e.getValue();
        d.put(e.getKey(), (v instanceof MultiValue || v instanceof ListField) ? List.copyOf((List<?>) v) : v);
      }
      out.add(d);
    }
    return out;
  }

  /** Marks lists built from repeated keys, as opposed to scalar values that happen to be lists. */
  private static final class MultiValue extends ArrayList<Object> {
    private static final long serialVersionUID = 1L;
  }

  private static final class ListField extends ArrayList<Object> {
    private static final long serialVersionUID = 1L;
  }
}
