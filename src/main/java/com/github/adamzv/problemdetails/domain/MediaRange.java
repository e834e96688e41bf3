package com.github.adamzv.problemdetails.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One entry of an {@code Accept} header: a media type pattern and its quality weight.
 */
public record MediaRange(String type, String subtype, double quality) {

  private static final Logger log = LoggerFactory.getLogger(MediaRange.class);

  public static final String WILDCARD = "*";

  public static final int NO_MATCH = -1;

  public MediaRange {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(subtype, "subtype");
    if (type.isBlank() || subtype.isBlank()) {
      throw new IllegalArgumentException("Media range type and subtype must not be blank");
    }
    if (WILDCARD.equals(type) && !WILDCARD.equals(subtype)) {
      throw new IllegalArgumentException("Media range '*/" + subtype + "' is not valid");
    }
    if (Double.isNaN(quality) || quality < 0.0 || quality > 1.0) {
      throw new IllegalArgumentException("Quality must be within [0, 1], was " + quality);
    }
    type = type.trim().toLowerCase(Locale.ROOT);
    subtype = subtype.trim().toLowerCase(Locale.ROOT);
  }

  public static MediaRange of(String pattern, double quality) {
    MediaRange parsed = parse(pattern);
    return new MediaRange(parsed.type(), parsed.subtype(), quality);
  }

  /**
   * Parses a single range such as {@code application/json;q=0.5}. Parameters other than
   * {@code q} are ignored.
   *
   * @throws IllegalArgumentException if the range is not well formed
   */
  public static MediaRange parse(String range) {
    Objects.requireNonNull(range, "range");
    String[] parts = range.split(";");
    String mediaType = parts[0].trim();
    if (WILDCARD.equals(mediaType)) {
      mediaType = "*/*";
    }
    int slash = mediaType.indexOf('/');
    if (slash <= 0 || slash == mediaType.length() - 1 || mediaType.indexOf('/', slash + 1) >= 0) {
      throw new IllegalArgumentException("Invalid media range '" + range + "'");
    }
    double quality = 1.0;
    for (int i = 1; i < parts.length; i++) {
      String parameter = parts[i].trim();
      int equals = parameter.indexOf('=');
      if (equals > 0 && "q".equalsIgnoreCase(parameter.substring(0, equals).trim())) {
        try {
          quality = Double.parseDouble(parameter.substring(equals + 1).trim());
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("Invalid quality in media range '" + range + "'", ex);
        }
      }
    }
    return new MediaRange(mediaType.substring(0, slash), mediaType.substring(slash + 1), quality);
  }

  /**
   * Parses a whole {@code Accept} header, keeping entry order. Entries that cannot be parsed
   * are dropped; a {@code null} or blank header yields an empty list.
   */
  public static List<MediaRange> parseAll(String header) {
    if (header == null || header.isBlank()) {
      return List.of();
    }
    List<MediaRange> ranges = new ArrayList<>();
    for (String entry : header.split(",")) {
      if (entry.isBlank()) {
        continue;
      }
      try {
        ranges.add(parse(entry));
      } catch (IllegalArgumentException ex) {
        log.debug("accept_range_skipped range={} reason={}", entry.trim(), ex.getMessage());
      }
    }
    return List.copyOf(ranges);
  }

  /**
   * How specifically this range matches {@code mediaType}: 2 for an exact match, 1 for
   * {@code type/*}, 0 for {@code *}{@code /*} and {@link #NO_MATCH} otherwise.
   */
  public int specificity(String mediaType) {
    int slash = mediaType.indexOf('/');
    String candidateType = mediaType.substring(0, slash).toLowerCase(Locale.ROOT);
    String candidateSubtype = mediaType.substring(slash + 1).toLowerCase(Locale.ROOT);
    if (WILDCARD.equals(type)) {
      return 0;
    }
    if (!type.equals(candidateType)) {
      return NO_MATCH;
    }
    if (WILDCARD.equals(subtype)) {
      return 1;
    }
    return subtype.equals(candidateSubtype) ? 2 : NO_MATCH;
  }

  @Override
  public String toString() {
    return type + "/" + subtype + (quality < 1.0 ? ";q=" + quality : "");
  }
}
