package io.intellixity.optimade.entry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    if (field.isBlank()) throw new IllegalArgumentException("sort field must not be blank");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction { ASC, DESC }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  /** Parses the {@code sort} query parameter: {@code "-nelements,id"}. Blank input gives an empty list. */
  public static List<SortField> parseList(String sort) {
    if (sort == null || sort.isBlank()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String part : sort.split(",", -1)) {
      String p = part.trim();
      if (p.isEmpty() || p.equals("-")) throw new IllegalArgumentException("Empty sort field in '" + sort + "'");
      out.add(p.startsWith("-") ? desc(p.substring(1).trim()) : asc(p));
    }
    return List.copyOf(out);
  }

  @Override
  public String toString() { return (direction == Direction.DESC ? "-" : "") + field; }
}
