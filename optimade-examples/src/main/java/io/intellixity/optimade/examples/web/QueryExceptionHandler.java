package io.intellixity.optimade.examples.web;

import io.intellixity.optimade.spi.exec.QueryPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders failures as JSON:API error documents. */
@RestControllerAdvice
public class QueryExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(QueryExceptionHandler.class);

  @ExceptionHandler(QueryPipelineException.class)
  public ResponseEntity<Map<String, Object>> pipeline(QueryPipelineException e) {
    log.debug("optimade.examples failedStep={} status={}", e.failedStep(), e.status());
    Throwable cause = (e.getCause() == null) ? e : e.getCause();
    return errorDocument(e.status(), cause.getMessage());
  }

  @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<Map<String, Object>> badParameter(Exception e) {
    return errorDocument(HttpStatus.BAD_REQUEST.value(), e.getMessage());
  }

  static ResponseEntity<Map<String, Object>> errorDocument(int status, String detail) {
    HttpStatus resolved = HttpStatus.resolve(status);
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("status", String.valueOf(status));
    error.put("title", (resolved == null) ? "Error" : resolved.getReasonPhrase());
    error.put("detail", (detail == null) ? "" : detail);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("errors", List.of(error));
    return ResponseEntity.status(status).body(body);
  }
}
