package io.intellixity.optimade.client;

import okhttp3.HttpUrl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Builds {@code {base}/{version}/{endpoint}?filter=..&response_fields=..&page_limit=..&sort=..}. */
public final class QueryUrlBuilder {
  private final HttpUrl base;
  private String version = "v1";
  private String endpoint = "structures";
  private String filter;
  private List<String> responseFields;
  private Integer pageLimit;
  private String sort;
  private final Map<String, String> extra = new LinkedHashMap<>();

  private QueryUrlBuilder(HttpUrl base) {
    this.base = base;
  }

  public static QueryUrlBuilder forBase(String baseUrl) {
    Objects.requireNonNull(baseUrl, "baseUrl");
    HttpUrl url = HttpUrl.parse(baseUrl);
    if (url == null) throw new IllegalArgumentException("Not an http(s) URL: " + baseUrl);
    return new QueryUrlBuilder(url);
  }

  public QueryUrlBuilder version(String v) { this.version = Objects.requireNonNull(v, "version"); return this; }
  public QueryUrlBuilder endpoint(String e) { this.endpoint = Objects.requireNonNull(e, "endpoint"); return this; }
  public QueryUrlBuilder filter(String f) { this.filter = f; return this; }

  /** An empty list asks for ids only; null leaves the provider default. */
  public QueryUrlBuilder responseFields(List<String> fields) { this.responseFields = fields; return this; }

  public QueryUrlBuilder pageLimit(Integer limit) { this.pageLimit = limit; return this; }
  public QueryUrlBuilder sort(String s) { this.sort = s; return this; }

  public QueryUrlBuilder param(String name, Object value) {
    extra.put(Objects.requireNonNull(name, "name"), String.valueOf(value));
    return this;
  }

  public HttpUrl build() {
    HttpUrl.Builder b = base.newBuilder();
    // drop trailing slashes of the base path
    List<String> segments = base.pathSegments();
    int keep = segments.size();
    while (keep > 0 && segments.get(keep - 1).isEmpty()) keep--;
    for (int i = segments.size() - 1; i >= 0; i--) b.removePathSegment(i);
    for (int i = 0; i < keep; i++) b.addPathSegment(segments.get(i));
    b.addPathSegment(version).addPathSegment(endpoint);

    if (filter != null && !filter.isBlank()) b.addQueryParameter("filter", filter);
    if (responseFields != null) {
      b.addQueryParameter("response_fields", responseFields.isEmpty() ? "id" : String.join(",", responseFields));
    }
    if (pageLimit != null) b.addQueryParameter("page_limit", String.valueOf(pageLimit));
    if (sort != null && !sort.isBlank()) b.addQueryParameter("sort", sort);
    for (var e : extra.entrySet()) b.addQueryParameter(e.getKey(), e.getValue());
    return b.build();
  }
}
