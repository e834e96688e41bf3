package com.github.adamzv.problemdetails.domain;

import java.util.Objects;

public class ProblemDetailsException extends RuntimeException {

  private final DetailsError error;

  public ProblemDetailsException(DetailsError error) {
    this(error, null);
  }

  public ProblemDetailsException(DetailsError error, Throwable cause) {
    super(Objects.requireNonNull(error, "error").message(), cause);
    this.error = error;
  }

  public DetailsError error() {
    return error;
  }

  public String code() {
    return error.code();
  }

  /**
   * Whether this failure has the given {@link ErrorCodes error code}.
   */
  public boolean is(String code) {
    return error.code().equals(code);
  }

  /**
   * The detail recorded under {@code key}, e.g. the member name of a collision, or {@code null}.
   */
  public Object detail(String key) {
    return error.details().get(key);
  }
}
