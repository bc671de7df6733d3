package io.intellixity.optimade.filter.grammar;

import io.intellixity.optimade.filter.parse.AntlrFilterGrammar;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;

/** Pre-1.0 filter language (comparisons and boolean connectives, optional {@code filter=} prefix). */
public final class LegacyFilterV0Grammar extends AntlrFilterGrammar<LegacyFilterV0Parser> {
  @Override
  protected Lexer newLexer(CharStream input) { return new LegacyFilterV0Lexer(input); }

  @Override
  protected LegacyFilterV0Parser newParser(TokenStream tokens) { return new LegacyFilterV0Parser(tokens); }

  @Override
  protected ParserRuleContext startRule(LegacyFilterV0Parser parser) { return parser.filter(); }
}
