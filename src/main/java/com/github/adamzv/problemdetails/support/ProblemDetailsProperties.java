package com.github.adamzv.problemdetails.support;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "problem-details")
public record ProblemDetailsProperties(
    @Valid
    @DefaultValue
    Formats formats,
    @Min(value = 100, message = "problem-details.fallbackStatus must be >= 100")
    @Max(value = 599, message = "problem-details.fallbackStatus must be <= 599")
    @DefaultValue("500")
    int fallbackStatus
) {

  /**
   * Formats the negotiator may answer with. With both switched off the application fails
   * to start.
   */
  public record Formats(
      @DefaultValue("true")
      boolean json,
      @DefaultValue("false")
      boolean xml
  ) {}
}
