package io.intellixity.optimade.filter;

import java.util.List;
import java.util.Objects;

/** Dotted identifier path referenced by a filter, e.g. {@code species.chemical_symbols}. */
public record FieldPath(List<String> segments) {
  public FieldPath {
    Objects.requireNonNull(segments, "segments");
    if (segments.isEmpty()) throw new IllegalArgumentException("segments must not be empty");
    for (String s : segments) {
      if (s == null || s.isBlank()) throw new IllegalArgumentException("blank path segment in " + segments);
    }
    segments = List.copyOf(segments);
  }

  public static FieldPath of(String dotted) {
    Objects.requireNonNull(dotted, "dotted");
    return new FieldPath(List.of(dotted.split("\\.", -1)));
  }

  public String first() { return segments.get(0); }
  public boolean isNested() { return segments.size() > 1; }

  /** Path with the first segment replaced, remaining segments kept. */
  public FieldPath withFirst(String first) {
    if (segments.size() == 1) return new FieldPath(List.of(first));
    String[] out = segments.toArray(new String[0]);
    out[0] = first;
    return new FieldPath(List.of(out));
  }

  public String dotted() { return String.join(".", segments); }

  @Override
  public String toString() { return dotted(); }
}
