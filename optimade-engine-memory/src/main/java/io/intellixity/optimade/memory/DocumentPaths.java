package io.intellixity.optimade.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Dotted-path lookup and value comparison over nested maps and lists. */
final class DocumentPaths {
  private DocumentPaths() {}

  /** Value at {@code path}; lists met half-way are flattened. Null when absent. */
  static Object get(Map<String, Object> doc, List<String> path) {
    Object cur = doc;
    for (int i = 0; i < path.size(); i++) {
      if (cur instanceof Map<?, ?> m) {
        cur = m.get(path.get(i));
      } else if (cur instanceof Collection<?> c) {
        List<Object> out = new ArrayList<>();
        List<String> rest = path.subList(i, path.size());
        for (Object item : c) {
          if (!(item instanceof Map<?, ?>)) continue;
          @SuppressWarnings("unchecked")
          Object v = get((Map<String, Object>) item, rest);
          if (v instanceof Collection<?> nested) out.addAll(nested);
          else if (v != null) out.add(v);
        }
        return out.isEmpty() ? null : out;
      } else {
        return null;
      }
      if (cur == null) return null;
    }
    return cur;
  }

  /**
   * Compares two scalars of the same kind (numbers or strings).
   *
   * @return null when the values are of different kinds and cannot be compared
   */
  static Integer compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      if (isIntegral(x) && isIntegral(y)) return Long.compare(x.longValue(), y.longValue());
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    if (a instanceof String x && b instanceof String y) return x.compareTo(y);
    return null;
  }

  static boolean sameValue(Object a, Object b) {
    Integer c = compare(a, b);
    return c != null && c == 0;
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
        || n instanceof java.math.BigInteger;
  }
}
