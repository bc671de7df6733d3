package io.intellixity.optimade.spi.exec;

import io.intellixity.optimade.entry.InvariantViolationException;
import io.intellixity.optimade.entry.PageLimitExceededException;
import io.intellixity.optimade.filter.FilterSyntaxException;
import io.intellixity.optimade.filter.InvalidFilterException;
import io.intellixity.optimade.filter.NotImplementedFilterException;

import java.util.Objects;

/**
 * A request failed while working towards {@link #failedStep()}.
 * <p>
 * The cause is the original typed exception; {@link #status()} is the HTTP status a server
 * should answer with.
 */
public final class QueryPipelineException extends RuntimeException {
  private final PipelineStep failedStep;
  private final int status;

  public QueryPipelineException(PipelineStep failedStep, RuntimeException cause) {
    super(failedStep + " failed: " + cause.getMessage(), cause);
    this.failedStep = Objects.requireNonNull(failedStep, "failedStep");
    this.status = statusFor(cause);
  }

  public PipelineStep failedStep() { return failedStep; }
  public int status() { return status; }

  public static int statusFor(Throwable cause) {
    if (cause instanceof PageLimitExceededException) return 403;
    if (cause instanceof NotImplementedFilterException) return 501;
    if (cause instanceof InvariantViolationException) return 500;
    if (cause instanceof FilterSyntaxException
        || cause instanceof InvalidFilterException
        || cause instanceof IllegalArgumentException) {
      return 400;
    }
    return 500;
  }
}
