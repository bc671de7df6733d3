package io.intellixity.optimade.entry;

/** Internal consistency check failed (e.g. several entries share one id). */
public final class InvariantViolationException extends RuntimeException {
  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
