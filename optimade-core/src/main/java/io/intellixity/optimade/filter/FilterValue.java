package io.intellixity.optimade.filter;

/**
 * Literal operand of a filter node.
 *
 * The kind is decided once while normalizing, so transformers switch on {@link #kind()}
 * instead of inspecting runtime types.
 */
public sealed interface FilterValue permits NumberValue, StringValue, ListValue, PropertyValue {
  enum Kind { INT, FLOAT, STRING, LIST, PROPERTY }

  Kind kind();

  /** Plain Java value: Long, Double, String, List or the dotted property path. */
  Object raw();
}
