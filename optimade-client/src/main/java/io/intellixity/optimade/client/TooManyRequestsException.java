package io.intellixity.optimade.client;

/** The provider answered 429; the same request may succeed when repeated. */
public final class TooManyRequestsException extends RuntimeException {
  private final String url;

  public TooManyRequestsException(String url, String body) {
    super("429 Too Many Requests from " + url + (body == null || body.isBlank() ? "" : ": " + body));
    this.url = url;
  }

  public String url() { return url; }
}
