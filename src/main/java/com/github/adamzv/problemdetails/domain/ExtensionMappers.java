package com.github.adamzv.problemdetails.domain;

import com.fasterxml.jackson.databind.ObjectMapper;

final class ExtensionMappers {

  // modules on the classpath (java.time, jdk8) are picked up so common value types bind
  static final ObjectMapper DEFAULT = new ObjectMapper().findAndRegisterModules();

  private ExtensionMappers() {
  }
}
