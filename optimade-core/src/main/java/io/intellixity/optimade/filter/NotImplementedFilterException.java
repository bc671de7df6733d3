package io.intellixity.optimade.filter;

/**
 * Raised by a transformer for a valid construct it cannot lower.
 * Carries the canonical text of the offending sub-expression.
 */
public final class NotImplementedFilterException extends RuntimeException {
  private final String expression;

  public NotImplementedFilterException(String expression, String reason) {
    super(reason + ": " + expression);
    this.expression = expression;
  }

  public String expression() { return expression; }
}
