package io.intellixity.optimade.entry;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Per-collection limits and field policy.
 *
 * @param providerPrefix own database-specific prefix without underscores (e.g. {@code exmpl}); may be null
 * @param knownFields    public top-level field names; empty disables the unknown-field check
 */
public record CollectionSettings(int pageLimit,
                                 int pageLimitMax,
                                 FieldStrictness strictness,
                                 String providerPrefix,
                                 Set<String> knownFields,
                                 Duration countTimeout) {
  public static final int DEFAULT_PAGE_LIMIT = 20;
  public static final int DEFAULT_PAGE_LIMIT_MAX = 500;
  public static final Duration DEFAULT_COUNT_TIMEOUT = Duration.ofSeconds(5);

  public CollectionSettings {
    if (pageLimit <= 0) throw new IllegalArgumentException("pageLimit must be > 0");
    if (pageLimitMax < pageLimit) throw new IllegalArgumentException("pageLimitMax must be >= pageLimit");
    strictness = (strictness == null) ? FieldStrictness.WARN : strictness;
    knownFields = (knownFields == null) ? Set.of() : Set.copyOf(knownFields);
    countTimeout = (countTimeout == null) ? DEFAULT_COUNT_TIMEOUT : countTimeout;
    if (countTimeout.isNegative() || countTimeout.isZero()) throw new IllegalArgumentException("countTimeout must be > 0");
  }

  public static CollectionSettings defaults() {
    return new CollectionSettings(DEFAULT_PAGE_LIMIT, DEFAULT_PAGE_LIMIT_MAX, FieldStrictness.WARN, null, Set.of(), DEFAULT_COUNT_TIMEOUT);
  }

  public CollectionSettings withPageLimits(int limit, int max) {
    return new CollectionSettings(limit, max, strictness, providerPrefix, knownFields, countTimeout);
  }

  public CollectionSettings withStrictness(FieldStrictness s) {
    return new CollectionSettings(pageLimit, pageLimitMax, Objects.requireNonNull(s, "s"), providerPrefix, knownFields, countTimeout);
  }

  public CollectionSettings withProviderPrefix(String prefix) {
    return new CollectionSettings(pageLimit, pageLimitMax, strictness, prefix, knownFields, countTimeout);
  }

  public CollectionSettings withKnownFields(Set<String> fields) {
    return new CollectionSettings(pageLimit, pageLimitMax, strictness, providerPrefix, fields, countTimeout);
  }

  public CollectionSettings withCountTimeout(Duration timeout) {
    return new CollectionSettings(pageLimit, pageLimitMax, strictness, providerPrefix, knownFields, timeout);
  }
}
