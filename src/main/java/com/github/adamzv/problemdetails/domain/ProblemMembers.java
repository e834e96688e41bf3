package com.github.adamzv.problemdetails.domain;

import java.util.List;

/**
 * Names of the standard problem details members, in the order they are written.
 */
public final class ProblemMembers {
  public static final String TYPE = "type";
  public static final String TITLE = "title";
  public static final String STATUS = "status";
  public static final String DETAIL = "detail";
  public static final String INSTANCE = "instance";

  public static final List<String> RESERVED = List.of(TYPE, TITLE, STATUS, DETAIL, INSTANCE);

  private ProblemMembers() {
  }

  public static boolean isReserved(String name) {
    return RESERVED.contains(name);
  }
}
