package io.intellixity.optimade.entry;

/** What to do with filter fields a collection does not know. */
public enum FieldStrictness {
  /** Report as a warning; the filter still runs and the field matches nothing. */
  WARN,
  /** Reject the filter. Fields carrying another provider's prefix are still only warnings. */
  STRICT
}
