package com.github.adamzv.problemdetails.domain;

public final class ErrorCodes {
  public static final String RESERVED_FIELD_COLLISION = "RESERVED_FIELD_COLLISION";
  public static final String DUPLICATE_EXTENSION_KEY = "DUPLICATE_EXTENSION_KEY";
  public static final String MALFORMED_DOCUMENT = "MALFORMED_DOCUMENT";
  public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
  public static final String NO_CODEC_AVAILABLE = "NO_CODEC_AVAILABLE";
  public static final String UNREPRESENTABLE_MEMBER = "UNREPRESENTABLE_MEMBER";

  private ErrorCodes() {
  }
}
