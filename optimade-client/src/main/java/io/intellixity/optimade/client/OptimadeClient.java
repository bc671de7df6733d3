package io.intellixity.optimade.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarRegistry;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one query against many OPTIMADE providers.
 * <p>
 * Each provider is paginated strictly in order by following {@code links.next}, until the last
 * page or until {@link ClientSettings#maxResultsPerProvider()} entries have arrived. A 429 answer
 * is retried with a fixed delay. Every other failure is recorded in that provider's
 * {@link QueryResults#errors()} and never affects the other providers. Filters are validated
 * locally before any request is made.
 */
public final class OptimadeClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OptimadeClient.class);

  /** Requests allowed while searching for a count. */
  static final int MAX_COUNT_REQUESTS = 100;

  private final List<String> baseUrls;
  private final ClientSettings settings;
  private final FilterCompiler validator;
  private final OkHttpClient http;
  private final ObjectMapper mapper;
  private final ExecutorService pool;

  public OptimadeClient(List<String> baseUrls, ClientSettings settings) {
    this(baseUrls, settings, new FilterCompiler(new FilterParser(GrammarRegistry.discover())), null);
  }

  public OptimadeClient(List<String> baseUrls, ClientSettings settings, FilterCompiler validator, OkHttpClient http) {
    Objects.requireNonNull(baseUrls, "baseUrls");
    if (baseUrls.isEmpty()) throw new IllegalArgumentException("At least one base URL is required");
    this.baseUrls = List.copyOf(new LinkedHashSet<>(baseUrls));
    this.settings = (settings == null) ? ClientSettings.defaults() : settings;
    this.validator = Objects.requireNonNull(validator, "validator");
    this.http = (http != null) ? http : new OkHttpClient.Builder().callTimeout(this.settings.timeout()).build();
    this.mapper = new ObjectMapper();
    this.pool = this.settings.useAsync()
        ? Executors.newFixedThreadPool(Math.min(this.settings.maxConcurrency(), this.baseUrls.size()), daemonThreads())
        : null;
  }

  public List<String> baseUrls() { return baseUrls; }
  public ClientSettings settings() { return settings; }
  ObjectMapper mapper() { return mapper; }

  /**
   * All pages of {@code endpoint?filter=...} from every provider, keyed by base URL in the order
   * the providers were given.
   *
   * @throws io.intellixity.optimade.filter.FilterSyntaxException if the filter does not parse
   * @throws io.intellixity.optimade.filter.InvalidFilterException if it parses but is invalid
   */
  public Map<String, QueryResults> get(String filter, String endpoint, List<String> responseFields, String sort) {
    String f = validated(filter);
    return fanOut(base -> getOne(base, endpoint, f, responseFields, sort, settings.pageLimit(), true, Map.of()),
        (base, e) -> {
          QueryResults failed = new QueryResults();
          failed.addError(describe(e));
          return failed;
        });
  }

  /**
   * Entry count per provider, from {@code meta.data_returned} of a one-entry page. Providers that
   * do not report it are counted by probing {@code page_offset}.
   */
  public Map<String, CountResult> count(String filter, String endpoint) {
    String f = validated(filter);
    return fanOut(base -> countOne(base, endpoint, f), (base, e) -> CountResult.failed(List.of(describe(e))));
  }

  /** Queries one provider; never throws for provider-side failures. */
  public QueryResults getOne(String baseUrl, String endpoint, String filter, List<String> responseFields,
                             String sort, Integer pageLimit, boolean paginate, Map<String, Object> params) {
    QueryResults results = new QueryResults();
    String next;
    try {
      QueryUrlBuilder b = QueryUrlBuilder.forBase(baseUrl)
          .version(settings.apiVersion())
          .endpoint(endpoint == null ? "structures" : endpoint)
          .filter(filter)
          .responseFields(responseFields)
          .pageLimit(pageLimit)
          .sort(sort);
      params.forEach(b::param);
      next = b.build().toString();
    } catch (IllegalArgumentException e) {
      results.addError(e.getMessage());
      return results;
    }

    try {
      while (next != null) {
        JsonNode page = fetchWithRetry(baseUrl, next, results.pages() + 1);
        results.update(page);
        next = results.nextUrl().orElse(null);

        int cap = settings.maxResultsPerProvider();
        if (cap > 0 && results.data().size() >= cap) {
          if (next != null) {
            log.info("optimade.client provider={} results={} cap={} stopping", baseUrl, results.data().size(), cap);
          }
          break;
        }
        if (!paginate) break;
      }
    } catch (ProviderQueryException | IllegalArgumentException e) {
      log.warn("optimade.client provider={} failed error={}", baseUrl, e.getMessage());
      results.addError(e.getMessage());
    } catch (RuntimeException e) {
      log.error("optimade.client provider={} failed unexpectedly", baseUrl, e);
      results.addError(describe(e));
    }
    return results;
  }

  private CountResult countOne(String baseUrl, String endpoint, String filter) {
    QueryResults first = getOne(baseUrl, endpoint, filter, List.of(), null, 1, false, Map.of());
    if (first.failed()) return CountResult.failed(first.errors());
    OptionalLong reported = first.dataReturned();
    if (reported.isPresent()) return CountResult.reported(reported.getAsLong());
    if (first.data().isEmpty()) return CountResult.searched(0);

    log.info("optimade.client provider={} data_returned missing; searching count", baseUrl);
    try {
      return CountResult.searched(searchCount(offset -> hasEntryAt(baseUrl, endpoint, filter, offset)));
    } catch (ProviderQueryException e) {
      log.warn("optimade.client provider={} count failed error={}", baseUrl, e.getMessage());
      return CountResult.failed(List.of(e.getMessage()));
    } catch (RuntimeException e) {
      log.error("optimade.client provider={} count failed unexpectedly", baseUrl, e);
      return CountResult.failed(List.of(describe(e)));
    }
  }

  private boolean hasEntryAt(String baseUrl, String endpoint, String filter, long offset) {
    QueryResults r = getOne(baseUrl, endpoint, filter, List.of(), null, 1, false, Map.of("page_offset", offset));
    if (r.failed()) throw new ProviderQueryException("Count request at page_offset=" + offset + " failed: " + r.errors());
    return !r.data().isEmpty();
  }

  /**
   * Smallest offset without an entry, given that offset 0 has one. Grows the offset tenfold until
   * it overshoots, then bisects. A provider that answers every offset is reported as a failure
   * once the next offset would no longer fit in a {@code long}.
   */
  static long searchCount(Function<Long, Boolean> hasEntryAt) {
    int requests = 0;
    long lo = 0;
    long hi = 1;
    while (true) {
      if (++requests > MAX_COUNT_REQUESTS) throw new ProviderQueryException("Count search exceeded " + MAX_COUNT_REQUESTS + " requests");
      if (!hasEntryAt.apply(hi)) break;
      lo = hi;
      if (hi > Long.MAX_VALUE / 10) {
        throw new ProviderQueryException("Count search found entries at every requested page_offset up to " + hi
            + "; the provider appears to ignore page_offset");
      }
      hi = hi * 10;
    }
    while (hi - lo > 1) {
      if (++requests > MAX_COUNT_REQUESTS) throw new ProviderQueryException("Count search exceeded " + MAX_COUNT_REQUESTS + " requests");
      long mid = lo + (hi - lo) / 2;
      if (hasEntryAt.apply(mid)) lo = mid;
      else hi = mid;
    }
    return hi;
  }

  private JsonNode fetchWithRetry(String baseUrl, String url, int pageNo) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return fetch(baseUrl, url, pageNo);
      } catch (TooManyRequestsException e) {
        if (attempt >= settings.maxAttempts()) {
          throw new ProviderQueryException("Exceeded maximum number of retries (" + settings.maxAttempts() + ") for " + url, e);
        }
        log.warn("optimade.client provider={} page={} status=429 attempt={} retryInMs={}",
            baseUrl, pageNo, attempt, settings.retryDelay().toMillis());
        sleep(settings.retryDelay().toMillis());
      }
    }
  }

  private JsonNode fetch(String baseUrl, String url, int pageNo) {
    Request req = new Request.Builder().url(url).header("Accept", "application/vnd.api+json, application/json").get().build();
    long t0 = System.nanoTime();
    try (Response resp = http.newCall(req).execute()) {
      ResponseBody body = resp.body();
      String text = (body == null) ? "" : body.string();
      if (log.isDebugEnabled()) {
        log.debug("optimade.client provider={} page={} status={} durationMs={} url={}",
            baseUrl, pageNo, resp.code(), (System.nanoTime() - t0) / 1_000_000.0, url);
      }
      if (resp.code() == 429) throw new TooManyRequestsException(url, text);
      if (!resp.isSuccessful()) {
        throw new ProviderQueryException(resp.code() + " - " + url + ": " + errorMessage(text));
      }
      try {
        return mapper.readTree(text);
      } catch (JsonProcessingException e) {
        throw new ProviderQueryException("Could not decode response from " + url + " as JSON", e);
      }
    } catch (IOException e) {
      throw new ProviderQueryException("Request to " + url + " failed: " + e.getMessage(), e);
    }
  }

  /** JSON:API error titles and details, or the raw body when it is not such a document. */
  private String errorMessage(String body) {
    JsonNode doc;
    try {
      doc = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      log.debug("optimade.client error body is not JSON: {}", e.getOriginalMessage());
      return body;
    }
    if (doc == null || !doc.path("errors").isArray() || doc.path("errors").isEmpty()) return body;
    List<String> parts = new ArrayList<>();
    for (JsonNode err : doc.path("errors")) parts.add(QueryResults.describeError(err));
    return String.join("; ", parts);
  }

  /** Runs {@code task} per provider; a task that throws yields {@code onFailure} for that provider only. */
  private <T> Map<String, T> fanOut(Function<String, T> task, BiFunction<String, RuntimeException, T> onFailure) {
    Function<String, T> isolated = base -> {
      try {
        return task.apply(base);
      } catch (RuntimeException e) {
        log.error("optimade.client provider={} task failed", base, e);
        return onFailure.apply(base, e);
      }
    };
    Map<String, T> merged = new LinkedHashMap<>();
    if (pool == null) {
      for (String base : baseUrls) merged.put(base, isolated.apply(base));
      return merged;
    }
    Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
    for (String base : baseUrls) futures.put(base, CompletableFuture.supplyAsync(() -> isolated.apply(base), pool));
    CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();
    futures.forEach((base, f) -> merged.put(base, f.join()));
    return merged;
  }

  private static String describe(RuntimeException e) {
    return (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + e.getMessage();
  }

  private String validated(String filter) {
    if (filter == null || filter.isBlank()) return "";
    validator.validate(filter);
    return filter;
  }

  private static void sleep(long millis) {
    if (millis <= 0) return;
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderQueryException("Interrupted while waiting to retry", e);
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "optimade-client-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public void close() {
    if (pool == null) return;
    pool.shutdown();
    try {
      if (!pool.awaitTermination(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)) pool.shutdownNow();
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
