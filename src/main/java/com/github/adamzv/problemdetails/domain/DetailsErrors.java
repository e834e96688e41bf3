package com.github.adamzv.problemdetails.domain;

import java.util.Map;

public final class DetailsErrors {

  private DetailsErrors() {
  }

  public static ProblemDetailsException reservedFieldCollision(String name) {
    return raise(
        ErrorCodes.RESERVED_FIELD_COLLISION,
        "Extension member name is reserved for a standard field",
        Map.of("name", name),
        null
    );
  }

  public static ProblemDetailsException duplicateExtensionKey(String name) {
    return raise(
        ErrorCodes.DUPLICATE_EXTENSION_KEY,
        "Extension member was already set",
        Map.of("name", name),
        null
    );
  }

  public static ProblemDetailsException malformedDocument(String message, Map<String, Object> details, Throwable cause) {
    return raise(ErrorCodes.MALFORMED_DOCUMENT, message, details, cause);
  }

  public static ProblemDetailsException typeMismatch(String member, String expected) {
    return raise(
        ErrorCodes.TYPE_MISMATCH,
        "Member '" + member + "' must be " + expected,
        Map.of("member", member, "expected", expected),
        null
    );
  }

  public static ProblemDetailsException noCodecAvailable() {
    return raise(
        ErrorCodes.NO_CODEC_AVAILABLE,
        "At least one problem details format must be enabled",
        Map.of(),
        null
    );
  }

  public static ProblemDetailsException unrepresentableMember(String name, String format) {
    return raise(
        ErrorCodes.UNREPRESENTABLE_MEMBER,
        "Extension member cannot be represented in " + format,
        Map.of("name", name, "format", format),
        null
    );
  }

  private static ProblemDetailsException raise(String code, String message, Map<String, Object> details,
      Throwable cause) {
    return new ProblemDetailsException(new DetailsError(code, message, details), cause);
  }
}
