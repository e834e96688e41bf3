package com.github.adamzv.problemdetails.adapters.xml;

final class XmlNames {

  private XmlNames() {
  }

  /**
   * Whether {@code name} can be used as an unprefixed element name (an XML NCName).
   */
  static boolean isElementName(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    int first = name.codePointAt(0);
    if (!isNameStart(first)) {
      return false;
    }
    for (int i = Character.charCount(first); i < name.length(); ) {
      int codePoint = name.codePointAt(i);
      if (!isNameStart(codePoint)
          && !Character.isDigit(codePoint)
          && codePoint != '-'
          && codePoint != '.'
          && codePoint != 0xB7
          && Character.getType(codePoint) != Character.NON_SPACING_MARK
          && Character.getType(codePoint) != Character.COMBINING_SPACING_MARK) {
        return false;
      }
      i += Character.charCount(codePoint);
    }
    return true;
  }

  private static boolean isNameStart(int codePoint) {
    return codePoint == '_' || Character.isLetter(codePoint);
  }

  /**
   * Whether every character of {@code text} is allowed in an XML 1.0 document.
   */
  static boolean isXmlText(String text) {
    for (int i = 0; i < text.length(); ) {
      int codePoint = text.codePointAt(i);
      boolean allowed = codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
          || (codePoint >= 0x20 && codePoint <= 0xD7FF)
          || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
          || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
      if (!allowed) {
        return false;
      }
      i += Character.charCount(codePoint);
    }
    return true;
  }
}
