package io.intellixity.optimade.entry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Query parameters of one request.
 *
 * @param filter         filter text; null or blank matches everything
 * @param pageLimit      requested page size; null uses the collection default
 * @param pageOffset     offset of the first entry, ignored when {@code cursor} is set
 * @param cursor         token from a previous {@link QueryResultPage#nextCursor()}
 * @param sort           requested order; the collection appends an {@code id} tie-breaker
 * @param responseFields attributes to return; empty returns all
 */
public record EntryQuery(String filter,
                         Integer pageLimit,
                         int pageOffset,
                         String cursor,
                         List<SortField> sort,
                         Set<String> responseFields) {
  public EntryQuery {
    sort = (sort == null) ? List.of() : List.copyOf(sort);
    responseFields = (responseFields == null) ? Set.of() : Set.copyOf(responseFields);
  }

  public static EntryQuery all() { return new EntryQuery(null, null, 0, null, List.of(), Set.of()); }

  public static EntryQuery of(String filter) { return new EntryQuery(filter, null, 0, null, List.of(), Set.of()); }

  public EntryQuery withPageLimit(Integer limit) {
    return new EntryQuery(filter, limit, pageOffset, cursor, sort, responseFields);
  }

  public EntryQuery withPageOffset(int offset) {
    return new EntryQuery(filter, pageLimit, offset, cursor, sort, responseFields);
  }

  public EntryQuery withCursor(String token) {
    return new EntryQuery(filter, pageLimit, pageOffset, token, sort, responseFields);
  }

  public EntryQuery withSort(String sortParam) {
    return new EntryQuery(filter, pageLimit, pageOffset, cursor, SortField.parseList(sortParam), responseFields);
  }

  /** Comma separated {@code response_fields} parameter. */
  public EntryQuery withResponseFields(String fields) {
    Set<String> out = new LinkedHashSet<>();
    if (fields != null) {
      for (String f : fields.split(",")) {
        if (!f.isBlank()) out.add(f.trim());
      }
    }
    return new EntryQuery(filter, pageLimit, pageOffset, cursor, sort, out);
  }

  public boolean hasFilter() { return filter != null && !filter.isBlank(); }

  @Override
  public String toString() {
    return "EntryQuery{filter=" + filter + ", pageLimit=" + pageLimit + ", pageOffset=" + pageOffset
        + ", cursor=" + cursor + ", sort=" + sort + ", responseFields=" + responseFields + "}";
  }
}
