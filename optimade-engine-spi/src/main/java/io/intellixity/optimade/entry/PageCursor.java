package io.intellixity.optimade.entry;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** Offset-based page position, exchanged with callers as an opaque URL-safe token. */
public record PageCursor(int offset) {
  private static final String PREFIX = "offset:";

  public PageCursor {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public String token() {
    byte[] raw = (PREFIX + offset).getBytes(StandardCharsets.US_ASCII);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
  }

  public static PageCursor parse(String token) {
    if (token == null || token.isBlank()) throw new IllegalArgumentException("Blank page cursor");
    String decoded;
    try {
      decoded = new String(Base64.getUrlDecoder().decode(token.trim()), StandardCharsets.US_ASCII);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid page cursor '" + token + "'", e);
    }
    if (!decoded.startsWith(PREFIX)) throw new IllegalArgumentException("Invalid page cursor '" + token + "'");
    try {
      return new PageCursor(Integer.parseInt(decoded.substring(PREFIX.length())));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid page cursor '" + token + "'", e);
    }
  }
}
