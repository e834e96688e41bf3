package com.github.adamzv.problemdetails.domain;

import java.util.Objects;

/**
 * Thrown by request handlers to answer with a problem details response.
 */
public class HttpProblemException extends RuntimeException {

  private final ProblemDetails problem;

  public HttpProblemException(ProblemDetails problem) {
    this(problem, null);
  }

  public HttpProblemException(ProblemDetails problem, Throwable cause) {
    super(describe(problem), cause);
    this.problem = problem;
  }

  public ProblemDetails problem() {
    return problem;
  }

  private static String describe(ProblemDetails problem) {
    Objects.requireNonNull(problem, "problem");
    if (problem.detail() != null) {
      return problem.detail();
    }
    return problem.title() != null ? problem.title() : problem.effectiveType().toString();
  }
}
