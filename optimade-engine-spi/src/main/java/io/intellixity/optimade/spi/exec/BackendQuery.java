package io.intellixity.optimade.spi.exec;

import io.intellixity.optimade.entry.SortField;

import java.util.List;
import java.util.Set;

/**
 * Resolved find parameters handed to a backend. Field names are backend names.
 *
 * @param projection backend fields to load; empty loads everything
 */
public record BackendQuery(List<SortField> sort, int offset, int limit, Set<String> projection) {
  public BackendQuery {
    sort = List.copyOf(sort);
    projection = (projection == null) ? Set.of() : Set.copyOf(projection);
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }
}
