package io.intellixity.optimade.filter.compile;

import io.intellixity.optimade.filter.FilterExpression;
import io.intellixity.optimade.filter.parse.FilterParser;
import io.intellixity.optimade.filter.parse.GrammarVersion;

import java.util.Objects;

/**
 * Parse + normalize in one call.
 * <p>
 * Thread-safe: both collaborators are stateless once built, so one compiler can be shared by
 * every collection and client in a process.
 */
public final class FilterCompiler {
  private final FilterParser parser;
  private final FilterNormalizer normalizer;

  public FilterCompiler(FilterParser parser) {
    this(parser, new FilterNormalizer());
  }

  public FilterCompiler(FilterParser parser, FilterNormalizer normalizer) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  public GrammarVersion version() { return parser.version(); }

  /**
   * @throws io.intellixity.optimade.filter.FilterSyntaxException if the filter does not parse
   * @throws io.intellixity.optimade.filter.InvalidFilterException if it parses but is semantically wrong
   */
  public FilterExpression compile(String filter) {
    return normalizer.normalize(parser.parse(filter));
  }

  public FilterExpression compile(String filter, GrammarVersion version) {
    return normalizer.normalize(parser.parse(filter, version));
  }

  /** Compiles and discards the tree; used to reject bad filters before any network call. */
  public void validate(String filter) {
    compile(filter);
  }
}
