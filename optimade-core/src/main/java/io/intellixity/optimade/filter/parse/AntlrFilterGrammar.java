package io.intellixity.optimade.filter.parse;

import io.intellixity.optimade.filter.FilterSyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base for grammars generated by ANTLR.
 * <p>
 * The first lexer or parser error aborts the parse with a {@link FilterSyntaxException};
 * the resulting parse tree is copied into {@link CstNode}s keyed by rule and token names.
 */
public abstract class AntlrFilterGrammar<P extends Parser> implements FilterGrammar {

  protected abstract Lexer newLexer(CharStream input);

  protected abstract P newParser(TokenStream tokens);

  /** Invoke the grammar's start rule. */
  protected abstract ParserRuleContext startRule(P parser);

  @Override
  public final CstNode parse(String filter) {
    Objects.requireNonNull(filter, "filter");
    ThrowingErrorListener errors = new ThrowingErrorListener(filter);

    Lexer lexer = newLexer(CharStreams.fromString(filter));
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);

    P parser = newParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errors);

    ParserRuleContext tree;
    try {
      tree = startRule(parser);
    } catch (RecognitionException | ParseCancellationException e) {
      throw new FilterSyntaxException("Unparseable filter", filter, e);
    }
    return toCst(tree, parser.getRuleNames(), parser.getVocabulary());
  }

  private static CstNode toCst(ParserRuleContext ctx, String[] ruleNames, Vocabulary vocabulary) {
    List<CstElement> children = new ArrayList<>(ctx.getChildCount());
    for (int i = 0; i < ctx.getChildCount(); i++) {
      ParseTree child = ctx.getChild(i);
      if (child instanceof ParserRuleContext rule) {
        children.add(toCst(rule, ruleNames, vocabulary));
      } else if (child instanceof TerminalNode terminal) {
        Token t = terminal.getSymbol();
        if (t.getType() == Token.EOF) continue;
        children.add(new CstToken(vocabulary.getSymbolicName(t.getType()), t.getText(), t.getLine(), t.getCharPositionInLine()));
      }
    }
    return new CstNode(ruleNames[ctx.getRuleIndex()], children);
  }

  private static final class ThrowingErrorListener extends BaseErrorListener {
    private final String filter;

    ThrowingErrorListener(String filter) {
      this.filter = filter;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
      String offending;
      if (offendingSymbol instanceof Token t) {
        offending = (t.getType() == Token.EOF) ? "" : t.getText();
      } else {
        offending = charAt(line, charPositionInLine);
      }
      throw new FilterSyntaxException(msg, filter, line, charPositionInLine, offending);
    }

    private String charAt(int line, int column) {
      String[] lines = filter.split("\n", -1);
      if (line < 1 || line > lines.length) return "";
      String l = lines[line - 1];
      return (column >= 0 && column < l.length()) ? String.valueOf(l.charAt(column)) : "";
    }
  }
}
