package com.github.adamzv.problemdetails.application;

import com.github.adamzv.problemdetails.domain.ErrorCodes;
import com.github.adamzv.problemdetails.domain.MediaRange;
import com.github.adamzv.problemdetails.domain.ProblemDetails;
import com.github.adamzv.problemdetails.domain.ProblemDetailsException;
import com.github.adamzv.problemdetails.domain.RenderedProblem;
import com.github.adamzv.problemdetails.ports.ProblemCodec;
import com.github.adamzv.problemdetails.ports.ResponseAdapter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a problem into status, content type and body for a request's {@code Accept} header.
 *
 * <p>The negotiated codec is tried first. A problem it cannot represent (for example an
 * extension name that is not an XML element name) is rendered by the remaining codecs in
 * priority order, so an error response is always produced while any format can carry it.
 */
public class ProblemRenderer {

  private static final Logger log = LoggerFactory.getLogger(ProblemRenderer.class);

  public static final int DEFAULT_FALLBACK_STATUS = 500;

  private final ContentNegotiator negotiator;
  private final int fallbackStatus;

  public ProblemRenderer(ContentNegotiator negotiator) {
    this(negotiator, DEFAULT_FALLBACK_STATUS);
  }

  public ProblemRenderer(ContentNegotiator negotiator, int fallbackStatus) {
    this.negotiator = Objects.requireNonNull(negotiator, "negotiator");
    if (!ProblemDetails.isValidStatus(fallbackStatus)) {
      throw new IllegalArgumentException("Fallback status must be between " + ProblemDetails.MIN_STATUS
          + " and " + ProblemDetails.MAX_STATUS + ", was " + fallbackStatus);
    }
    this.fallbackStatus = fallbackStatus;
  }

  public RenderedProblem render(ProblemDetails problem, String acceptHeader) {
    return render(problem, MediaRange.parseAll(acceptHeader));
  }

  public RenderedProblem render(ProblemDetails problem, List<MediaRange> preferences) {
    Objects.requireNonNull(problem, "problem");
    ProblemCodec selected = negotiator.select(preferences);
    int status = problem.status() != null ? problem.status() : fallbackStatus;
    try {
      return new RenderedProblem(status, selected.contentType(), selected.encode(problem));
    } catch (ProblemDetailsException ex) {
      if (!ex.is(ErrorCodes.UNREPRESENTABLE_MEMBER)) {
        throw ex;
      }
      return renderWithRemainingCodecs(problem, status, selected, ex);
    }
  }

  private RenderedProblem renderWithRemainingCodecs(
      ProblemDetails problem,
      int status,
      ProblemCodec failed,
      ProblemDetailsException failure
  ) {
    ProblemDetailsException last = failure;
    for (ProblemCodec codec : negotiator.codecs()) {
      if (codec == failed) {
        continue;
      }
      log.debug("problem_negotiation_fallback from={} to={} member={}",
          failed.format(), codec.format(), last.detail("name"));
      try {
        return new RenderedProblem(status, codec.contentType(), codec.encode(problem));
      } catch (ProblemDetailsException ex) {
        if (!ex.is(ErrorCodes.UNREPRESENTABLE_MEMBER)) {
          throw ex;
        }
        last = ex;
      }
    }
    throw failure;
  }

  public <R> R render(ProblemDetails problem, String acceptHeader, ResponseAdapter<R> adapter) {
    return adapter.adapt(render(problem, acceptHeader));
  }

  public ContentNegotiator negotiator() {
    return negotiator;
  }

  public int fallbackStatus() {
    return fallbackStatus;
  }
}
