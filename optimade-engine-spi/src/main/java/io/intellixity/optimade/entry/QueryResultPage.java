package io.intellixity.optimade.entry;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One page of resources.
 *
 * @param dataReturned      total number of matches, not the page size
 * @param nextCursor        token for the following page; null when {@code moreDataAvailable} is false
 * @param unknownFields     referenced fields the collection does not know, reported as warnings
 */
public record QueryResultPage(List<Map<String, Object>> entries,
                              long dataReturned,
                              boolean moreDataAvailable,
                              String nextCursor,
                              Set<String> unknownFields) {
  public QueryResultPage {
    entries = List.copyOf(entries);
    unknownFields = (unknownFields == null) ? Set.of() : Set.copyOf(unknownFields);
    if (dataReturned < 0) throw new IllegalArgumentException("dataReturned must be >= 0");
    if (!moreDataAvailable && nextCursor != null) {
      throw new IllegalArgumentException("nextCursor set without more data available");
    }
  }

  public List<String> ids() {
    return entries.stream().map(e -> String.valueOf(e.get("id"))).toList();
  }
}
