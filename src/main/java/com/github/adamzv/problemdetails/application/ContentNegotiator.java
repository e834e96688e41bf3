package com.github.adamzv.problemdetails.application;

import com.github.adamzv.problemdetails.domain.DetailsErrors;
import com.github.adamzv.problemdetails.domain.MediaRange;
import com.github.adamzv.problemdetails.domain.ProblemFormat;
import com.github.adamzv.problemdetails.ports.ProblemCodec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the codec used to answer a request from the client's {@code Accept} preferences.
 *
 * <p>The codec whose media types match with the highest quality wins; equal qualities go
 * to the format declared first in {@link ProblemFormat}. When nothing matches, the
 * default codec is used, so negotiation itself never fails.
 */
public class ContentNegotiator {

  private static final Logger log = LoggerFactory.getLogger(ContentNegotiator.class);

  private final List<ProblemCodec> codecs;

  public ContentNegotiator(Collection<? extends ProblemCodec> codecs) {
    if (codecs == null || codecs.isEmpty()) {
      throw DetailsErrors.noCodecAvailable();
    }
    List<ProblemCodec> ordered = new ArrayList<>();
    for (ProblemCodec codec : codecs) {
      boolean duplicate = ordered.stream().anyMatch(existing -> existing.format() == codec.format());
      if (duplicate) {
        throw new IllegalArgumentException("More than one codec registered for " + codec.format());
      }
      ordered.add(codec);
    }
    ordered.sort(Comparator.comparing(ProblemCodec::format));
    this.codecs = List.copyOf(ordered);
  }

  public static ContentNegotiator of(ProblemCodec... codecs) {
    return new ContentNegotiator(List.of(codecs));
  }

  public ProblemCodec select(String acceptHeader) {
    return select(MediaRange.parseAll(acceptHeader));
  }

  public ProblemCodec select(List<MediaRange> preferences) {
    if (preferences == null || preferences.isEmpty()) {
      return defaultCodec();
    }
    ProblemCodec best = null;
    double bestQuality = 0.0;
    for (ProblemCodec codec : codecs) {
      double quality = quality(codec.format(), preferences);
      if (quality > bestQuality) {
        best = codec;
        bestQuality = quality;
      }
    }
    if (best == null) {
      log.debug("problem_negotiation_fallback accept={} format={}", preferences, defaultCodec().format());
      return defaultCodec();
    }
    return best;
  }

  public ProblemCodec defaultCodec() {
    return codecs.get(0);
  }

  public List<ProblemFormat> formats() {
    return codecs.stream().map(ProblemCodec::format).toList();
  }

  public List<ProblemCodec> codecs() {
    return codecs;
  }

  /**
   * Codec able to read a document sent with {@code contentType}, if that format is enabled.
   */
  public Optional<ProblemCodec> codecForContentType(String contentType) {
    return codecs.stream()
        .filter(codec -> codec.format().answers(contentType))
        .findFirst();
  }

  /**
   * Quality the client assigns to {@code format}: the weight of the most specific range
   * matching any of its media types, the highest weight among equally specific ones.
   */
  static double quality(ProblemFormat format, List<MediaRange> preferences) {
    int bestSpecificity = MediaRange.NO_MATCH;
    double quality = 0.0;
    for (String mediaType : format.acceptedMediaTypes()) {
      for (MediaRange range : preferences) {
        int specificity = range.specificity(mediaType);
        if (specificity > bestSpecificity) {
          bestSpecificity = specificity;
          quality = range.quality();
        } else if (specificity == bestSpecificity && specificity != MediaRange.NO_MATCH) {
          quality = Math.max(quality, range.quality());
        }
      }
    }
    return quality;
  }
}
