package io.intellixity.optimade.filter.grammar;

import io.intellixity.optimade.filter.parse.AntlrFilterGrammar;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.TokenStream;

/** OPTIMADE v1.0.0 filter language. */
public final class OptimadeFilterV1Grammar extends AntlrFilterGrammar<OptimadeFilterV1Parser> {
  @Override
  protected Lexer newLexer(CharStream input) { return new OptimadeFilterV1Lexer(input); }

  @Override
  protected OptimadeFilterV1Parser newParser(TokenStream tokens) { return new OptimadeFilterV1Parser(tokens); }

  @Override
  protected ParserRuleContext startRule(OptimadeFilterV1Parser parser) { return parser.filter(); }
}
