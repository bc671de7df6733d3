package io.intellixity.optimade.client;

/** A provider could not answer a query: bad status, I/O failure, unreadable body or retries used up. */
public final class ProviderQueryException extends RuntimeException {
  public ProviderQueryException(String message) { super(message); }
  public ProviderQueryException(String message, Throwable cause) { super(message, cause); }
}
