package com.github.adamzv.problemdetails.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A problem ready to be written by a web framework: status line, {@code Content-Type}
 * and body bytes.
 */
public record RenderedProblem(int status, String contentType, byte[] body) {

  public RenderedProblem {
    Objects.requireNonNull(contentType, "contentType");
    Objects.requireNonNull(body, "body");
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RenderedProblem other)) {
      return false;
    }
    return status == other.status
        && contentType.equals(other.contentType)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, contentType, Arrays.hashCode(body));
  }

  @Override
  public String toString() {
    return "RenderedProblem[status=" + status + ", contentType=" + contentType + ", bodyBytes="
        + body.length + "]";
  }
}
