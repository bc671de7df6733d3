package io.intellixity.optimade.jdbc;

/** A database call failed while running an entry query. */
public final class JdbcQueryException extends RuntimeException {
  public JdbcQueryException(String message) { super(message); }
  public JdbcQueryException(String message, Throwable cause) { super(message, cause); }
}
