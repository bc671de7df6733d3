package io.intellixity.optimade.filter;

/** Configuration error: a grammar version was requested that is not registered. */
public final class UnknownGrammarVersionException extends RuntimeException {
  public UnknownGrammarVersionException(String message) {
    super(message);
  }

  public UnknownGrammarVersionException(String message, Throwable cause) {
    super(message, cause);
  }
}
