package io.intellixity.optimade.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Client tuning.
 *
 * @param maxResultsPerProvider stop paginating a provider once this many entries arrived; 0 means no cap
 * @param pageLimit             {@code page_limit} sent with every query, or null for the provider default
 * @param maxAttempts           attempts per page when the provider answers 429
 * @param retryDelay            fixed wait between those attempts
 * @param useAsync              one task per provider on a pool, instead of one provider after the other
 * @param maxConcurrency        pool size in async mode
 * @param timeout               HTTP call timeout
 * @param apiVersion            URL version segment, e.g. {@code v1}
 */
public record ClientSettings(int maxResultsPerProvider,
                             Integer pageLimit,
                             int maxAttempts,
                             Duration retryDelay,
                             boolean useAsync,
                             int maxConcurrency,
                             Duration timeout,
                             String apiVersion) {
  public ClientSettings {
    if (maxResultsPerProvider < 0) throw new IllegalArgumentException("maxResultsPerProvider must be >= 0");
    if (pageLimit != null && pageLimit <= 0) throw new IllegalArgumentException("pageLimit must be > 0");
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must not be negative");
    if (maxConcurrency <= 0) throw new IllegalArgumentException("maxConcurrency must be > 0");
    Objects.requireNonNull(timeout, "timeout");
    if (apiVersion == null || !apiVersion.matches("v\\d+(\\.\\d+){0,2}")) {
      throw new IllegalArgumentException("apiVersion must look like 'v1', got '" + apiVersion + "'");
    }
  }

  public static ClientSettings defaults() {
    return new ClientSettings(1000, null, 5, Duration.ofSeconds(1), true, 8, Duration.ofSeconds(30), "v1");
  }

  public ClientSettings withMaxResultsPerProvider(int max) {
    return new ClientSettings(max, pageLimit, maxAttempts, retryDelay, useAsync, maxConcurrency, timeout, apiVersion);
  }

  public ClientSettings withPageLimit(Integer limit) {
    return new ClientSettings(maxResultsPerProvider, limit, maxAttempts, retryDelay, useAsync, maxConcurrency, timeout, apiVersion);
  }

  public ClientSettings withRetries(int attempts, Duration delay) {
    return new ClientSettings(maxResultsPerProvider, pageLimit, attempts, delay, useAsync, maxConcurrency, timeout, apiVersion);
  }

  public ClientSettings withAsync(boolean async) {
    return new ClientSettings(maxResultsPerProvider, pageLimit, maxAttempts, retryDelay, async, maxConcurrency, timeout, apiVersion);
  }

  public ClientSettings withMaxConcurrency(int n) {
    return new ClientSettings(maxResultsPerProvider, pageLimit, maxAttempts, retryDelay, useAsync, n, timeout, apiVersion);
  }

  public ClientSettings withTimeout(Duration t) {
    return new ClientSettings(maxResultsPerProvider, pageLimit, maxAttempts, retryDelay, useAsync, maxConcurrency, t, apiVersion);
  }
}
