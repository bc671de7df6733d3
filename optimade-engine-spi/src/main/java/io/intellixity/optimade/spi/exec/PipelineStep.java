package io.intellixity.optimade.spi.exec;

/** States a request moves through, in order. */
public enum PipelineStep {
  RECEIVED,
  PARSED,
  TRANSFORMED,
  EXECUTED,
  PAGINATED,
  RESPONDED
}
