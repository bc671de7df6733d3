package io.intellixity.optimade.filter;

/**
 * Raised when a syntactically valid filter is semantically wrong: a string predicate with a
 * numeric argument, a non-integer LENGTH, or an unknown field under strict checking.
 */
public final class InvalidFilterException extends RuntimeException {
  public InvalidFilterException(String message) {
    super(message);
  }

  public InvalidFilterException(String message, Throwable cause) {
    super(message, cause);
  }
}
