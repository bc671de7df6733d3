package io.intellixity.optimade.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Ordered tuple of values, as used by correlated comparisons ({@code "a":"b"}). */
public record ListValue(List<FilterValue> values) implements FilterValue {
  public ListValue {
    values = List.copyOf(Objects.requireNonNull(values, "values"));
  }

  @Override public Kind kind() { return Kind.LIST; }

  @Override
  public Object raw() {
    List<Object> out = new ArrayList<>(values.size());
    for (FilterValue v : values) out.add(v.raw());
    return out;
  }
}
