package io.intellixity.optimade.filter.parse;

/**
 * One registered revision of the filter language.
 * <p>
 * Implementations are stateless and safe to share across threads; each call builds its own
 * lexer and parser.
 */
public interface FilterGrammar {
  /** @throws io.intellixity.optimade.filter.FilterSyntaxException if the filter does not match */
  CstNode parse(String filter);
}
