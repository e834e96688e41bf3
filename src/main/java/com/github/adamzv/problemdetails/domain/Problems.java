package com.github.adamzv.problemdetails.domain;

public final class Problems {

  private Problems() {
  }

  public static ProblemDetails badRequest(String detail) {
    return withStatus(400, detail);
  }

  public static ProblemDetails unauthorized(String detail) {
    return withStatus(401, detail);
  }

  public static ProblemDetails forbidden(String detail) {
    return withStatus(403, detail);
  }

  public static ProblemDetails notFound(String detail) {
    return withStatus(404, detail);
  }

  public static ProblemDetails conflict(String detail) {
    return withStatus(409, detail);
  }

  public static ProblemDetails unprocessableContent(String detail) {
    return withStatus(422, detail);
  }

  public static ProblemDetails tooManyRequests(String detail) {
    return withStatus(429, detail);
  }

  public static ProblemDetails internalServerError(String detail) {
    return withStatus(500, detail);
  }

  public static ProblemDetails serviceUnavailable(String detail) {
    return withStatus(503, detail);
  }

  public static HttpProblemException raise(ProblemDetails problem) {
    return new HttpProblemException(problem);
  }

  private static ProblemDetails withStatus(int status, String detail) {
    return ProblemDetails.forStatus(status).withDetail(detail);
  }
}
