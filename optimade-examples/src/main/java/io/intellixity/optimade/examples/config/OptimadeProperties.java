package io.intellixity.optimade.examples.config;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.FieldStrictness;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "optimade")
public class OptimadeProperties {
  /** Version reported in {@code meta.api_version}. */
  private String apiVersion = "1.0.0";

  /** Filter grammar tag, e.g. {@code v1.0.0}; empty uses the latest registered grammar. */
  private String grammarVersion;

  private final Structures structures = new Structures();

  public String getApiVersion() { return apiVersion; }
  public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }
  public String getGrammarVersion() { return grammarVersion; }
  public void setGrammarVersion(String grammarVersion) { this.grammarVersion = grammarVersion; }
  public Structures getStructures() { return structures; }

  public static class Structures {
    private int pageLimit = CollectionSettings.DEFAULT_PAGE_LIMIT;
    private int pageLimitMax = CollectionSettings.DEFAULT_PAGE_LIMIT_MAX;
    private FieldStrictness strictness = FieldStrictness.WARN;
    private String providerPrefix;
    private List<String> knownFields = new ArrayList<>();
    private Duration countTimeout = CollectionSettings.DEFAULT_COUNT_TIMEOUT;

    /** Public field name to stored field name. */
    private final Map<String, String> aliases = new HashMap<>();

    /** List field to the field holding its length. */
    private final Map<String, String> lengthAliases = new HashMap<>();

    /** Classpath JSON array of stored documents. */
    private String fixture = "data/structures.json";

    public int getPageLimit() { return pageLimit; }
    public void setPageLimit(int pageLimit) { this.pageLimit = pageLimit; }
    public int getPageLimitMax() { return pageLimitMax; }
    public void setPageLimitMax(int pageLimitMax) { this.pageLimitMax = pageLimitMax; }
    public FieldStrictness getStrictness() { return strictness; }
    public void setStrictness(FieldStrictness strictness) { this.strictness = strictness; }
    public String getProviderPrefix() { return providerPrefix; }
    public void setProviderPrefix(String providerPrefix) { this.providerPrefix = providerPrefix; }
    public List<String> getKnownFields() { return knownFields; }
    public void setKnownFields(List<String> knownFields) { this.knownFields = knownFields; }
    public Duration getCountTimeout() { return countTimeout; }
    public void setCountTimeout(Duration countTimeout) { this.countTimeout = countTimeout; }
    public Map<String, String> getAliases() { return aliases; }
    public Map<String, String> getLengthAliases() { return lengthAliases; }
    public String getFixture() { return fixture; }
    public void setFixture(String fixture) { this.fixture = fixture; }
  }
}
