package io.intellixity.optimade.client;

import java.util.List;

/**
 * Number of entries one provider holds for a filter.
 *
 * @param count    null when the provider failed
 * @param searched true when the provider gave no {@code meta.data_returned} and the count was searched for
 */
public record CountResult(Long count, boolean searched, List<String> errors) {
  public CountResult {
    errors = (errors == null) ? List.of() : List.copyOf(errors);
    if (count == null && errors.isEmpty()) throw new IllegalArgumentException("A missing count needs an error");
  }

  public static CountResult reported(long count) { return new CountResult(count, false, List.of()); }
  public static CountResult searched(long count) { return new CountResult(count, true, List.of()); }
  public static CountResult failed(List<String> errors) { return new CountResult(null, false, errors); }

  public boolean ok() { return errors.isEmpty(); }
}
