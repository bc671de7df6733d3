package io.intellixity.optimade.entry;

/** Requested page limit is above the collection maximum; raised before any backend access. */
public final class PageLimitExceededException extends RuntimeException {
  private final int requested;
  private final int max;

  public PageLimitExceededException(int requested, int max) {
    super("page_limit " + requested + " exceeds the maximum of " + max);
    this.requested = requested;
    this.max = max;
  }

  public int requested() { return requested; }
  public int max() { return max; }
}
