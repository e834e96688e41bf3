package com.github.adamzv.problemdetails.adapters.web;

import com.github.adamzv.problemdetails.application.ProblemRenderer;
import com.github.adamzv.problemdetails.domain.HttpProblemException;
import com.github.adamzv.problemdetails.domain.ProblemDetails;
import com.github.adamzv.problemdetails.domain.RenderedProblem;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Answers {@link HttpProblemException}s thrown from controllers with a negotiated problem
 * details body.
 */
@RestControllerAdvice
public class ProblemDetailsExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ProblemDetailsExceptionHandler.class);

  private final ProblemRenderer renderer;
  private final ResponseEntityAdapter adapter;
  private final MeterRegistry meterRegistry;

  public ProblemDetailsExceptionHandler(ProblemRenderer renderer, ResponseEntityAdapter adapter,
      MeterRegistry meterRegistry) {
    this.renderer = renderer;
    this.adapter = adapter;
    this.meterRegistry = meterRegistry;
  }

  @ExceptionHandler(HttpProblemException.class)
  public ResponseEntity<byte[]> handleProblem(HttpProblemException ex,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    ProblemDetails problem = ex.problem();
    RenderedProblem rendered = renderer.render(problem, accept);
    if (rendered.status() >= 500) {
      log.warn(
          "problem_rendered status={} type={} contentType={} detail={}",
          rendered.status(),
          problem.effectiveType(),
          rendered.contentType(),
          problem.detail(),
          ex
      );
    } else {
      log.info(
          "problem_rendered status={} type={} contentType={} detail={}",
          rendered.status(),
          problem.effectiveType(),
          rendered.contentType(),
          problem.detail()
      );
    }
    recordRendered(rendered);
    return adapter.adapt(rendered);
  }

  private void recordRendered(RenderedProblem rendered) {
    if (meterRegistry == null) {
      return;
    }
    meterRegistry.counter(
            "problem_details_rendered_total",
            "status", Integer.toString(rendered.status()),
            "contentType", rendered.contentType())
        .increment();
  }
}
