package io.intellixity.optimade.entry;

/**
 * One queryable OPTIMADE entry endpoint (structures, references, ...).
 * <p>
 * Failures surface as {@link io.intellixity.optimade.spi.exec.QueryPipelineException} carrying the
 * failed step, the typed cause and an HTTP-equivalent status.
 */
public interface EntryCollection {
  /** Entry type served, e.g. {@code structures}. */
  String entryType();

  QueryResultPage find(EntryQuery query);

  /** Single-entry retrieval: at most one result, never more data available. */
  QueryResultPage findEntry(String id, EntryQuery query);

  /** Number of entries matching {@code filter}; a blank filter counts everything. */
  long count(String filter);
}
