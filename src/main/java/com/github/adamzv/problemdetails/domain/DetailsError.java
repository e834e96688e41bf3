package com.github.adamzv.problemdetails.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Structured failure carried by {@link ProblemDetailsException}: a code from {@link ErrorCodes},
 * a human-readable message and the offending values keyed by name.
 */
public record DetailsError(
    String code,
    String message,
    Map<String, Object> details
) {

  public DetailsError {
    Objects.requireNonNull(code, "code");
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
