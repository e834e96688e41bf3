package com.github.adamzv.problemdetails.domain;

import java.util.List;

/**
 * Wire formats for problem details. Declaration order is negotiation priority: when a
 * client weighs several formats equally the earlier constant wins.
 */
public enum ProblemFormat {
  JSON("application/problem+json", List.of("application/problem+json", "application/json")),
  XML("application/problem+xml", List.of("application/problem+xml", "application/xml", "text/xml"));

  private final String contentType;
  private final List<String> acceptedMediaTypes;

  ProblemFormat(String contentType, List<String> acceptedMediaTypes) {
    this.contentType = contentType;
    this.acceptedMediaTypes = acceptedMediaTypes;
  }

  public String contentType() {
    return contentType;
  }

  /**
   * Media types a client may ask for to receive this format, most specific first.
   */
  public List<String> acceptedMediaTypes() {
    return acceptedMediaTypes;
  }

  public boolean answers(String mediaType) {
    if (mediaType == null) {
      return false;
    }
    int separator = mediaType.indexOf(';');
    String bare = (separator >= 0 ? mediaType.substring(0, separator) : mediaType).trim();
    return acceptedMediaTypes.stream().anyMatch(bare::equalsIgnoreCase);
  }
}
