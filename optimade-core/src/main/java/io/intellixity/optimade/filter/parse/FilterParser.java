package io.intellixity.optimade.filter.parse;

import java.util.Objects;

/**
 * Parses filter strings with a grammar taken from a {@link GrammarRegistry}.
 * Without an explicit version the registry's latest grammar is used.
 */
public final class FilterParser {
  private final GrammarRegistry registry;
  private final GrammarVersion version;
  private final FilterGrammar grammar;

  public FilterParser(GrammarRegistry registry) {
    this(registry, Objects.requireNonNull(registry, "registry").latestVersion());
  }

  /** @throws io.intellixity.optimade.filter.UnknownGrammarVersionException if the version is not registered */
  public FilterParser(GrammarRegistry registry, GrammarVersion version) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.version = Objects.requireNonNull(version, "version");
    this.grammar = registry.grammar(version);
  }

  public GrammarVersion version() { return version; }
  public GrammarRegistry registry() { return registry; }

  public CstNode parse(String filter) {
    return grammar.parse(filter);
  }

  public CstNode parse(String filter, GrammarVersion version) {
    if (version == null || version.equals(this.version)) return parse(filter);
    return registry.grammar(version).parse(filter);
  }
}
