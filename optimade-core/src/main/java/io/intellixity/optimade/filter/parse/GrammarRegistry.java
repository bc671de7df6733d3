package io.intellixity.optimade.filter.parse;

import io.intellixity.optimade.filter.UnknownGrammarVersionException;
import io.intellixity.optimade.util.OptimadeFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable set of filter grammars keyed by {@link GrammarVersion}.
 * <p>
 * Build it once at startup, either from {@value #RESOURCE} resources on the classpath
 * ({@link #discover()}) or explicitly ({@link #builder()}), and hand it to the parsers that need it.
 */
public final class GrammarRegistry {
  private static final Logger log = LoggerFactory.getLogger(GrammarRegistry.class);

  public static final String RESOURCE = "META-INF/optimade.grammars";

  private final TreeMap<GrammarVersion, FilterGrammar> grammars;

  private GrammarRegistry(TreeMap<GrammarVersion, FilterGrammar> grammars) {
    this.grammars = grammars;
  }

  public static GrammarRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static GrammarRegistry discover(ClassLoader cl) {
    Builder b = builder();
    for (var e : OptimadeFactoriesLoader.loadNamed(RESOURCE, FilterGrammar.class, cl).entrySet()) {
      b.register(e.getKey(), e.getValue());
    }
    GrammarRegistry registry = b.build();
    log.info("optimade.grammars versions={} default={}", registry.versions(), registry.latestVersion());
    return registry;
  }

  public static Builder builder() { return new Builder(); }

  public NavigableSet<GrammarVersion> versions() {
    return Collections.unmodifiableNavigableSet(grammars.navigableKeySet());
  }

  /** Highest registered default-variant version; falls back to the highest version of any variant. */
  public GrammarVersion latestVersion() {
    for (GrammarVersion v : grammars.descendingKeySet()) {
      if (v.isDefaultVariant()) return v;
    }
    return grammars.lastKey();
  }

  public boolean contains(GrammarVersion version) { return grammars.containsKey(version); }

  public FilterGrammar grammar(GrammarVersion version) {
    Objects.requireNonNull(version, "version");
    FilterGrammar g = grammars.get(version);
    if (g == null) {
      throw new UnknownGrammarVersionException(
          "Unknown filter grammar version " + version + "; registered: " + grammars.keySet());
    }
    return g;
  }

  public FilterGrammar latest() { return grammars.get(latestVersion()); }

  public static final class Builder {
    private final TreeMap<GrammarVersion, FilterGrammar> grammars = new TreeMap<>();

    private Builder() {}

    public Builder register(String tag, FilterGrammar grammar) {
      return register(GrammarVersion.parse(tag), grammar);
    }

    public Builder register(GrammarVersion version, FilterGrammar grammar) {
      Objects.requireNonNull(version, "version");
      Objects.requireNonNull(grammar, "grammar");
      FilterGrammar prev = grammars.putIfAbsent(version, grammar);
      if (prev != null && prev.getClass() != grammar.getClass()) {
        throw new IllegalStateException("Grammar version " + version + " registered twice: "
            + prev.getClass().getName() + ", " + grammar.getClass().getName());
      }
      return this;
    }

    public GrammarRegistry build() {
      if (grammars.isEmpty()) {
        throw new UnknownGrammarVersionException("No filter grammars registered (missing " + RESOURCE + "?)");
      }
      return new GrammarRegistry(new TreeMap<>(Map.copyOf(grammars)));
    }
  }
}
