package io.intellixity.optimade.filter.parse;

import java.util.Objects;

/** Lexical unit: grammar token type (e.g. {@code IDENTIFIER}, {@code OPERATOR}, {@code AND}) and raw text. */
public record CstToken(String type, String text, int line, int column) implements CstElement {
  public CstToken {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(text, "text");
  }

  public boolean is(String tokenType) { return type.equals(tokenType); }
}
