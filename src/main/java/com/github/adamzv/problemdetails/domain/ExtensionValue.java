package com.github.adamzv.problemdetails.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * An extension member value whose concrete type has been erased.
 *
 * <p>Every value renders itself as a format-neutral tree; the JSON and XML codecs
 * only ever see that tree. Applications with their own representation needs can
 * implement this interface directly, everything else goes through {@link #of(Object)},
 * which serializes the value with Jackson at the moment it is attached.
 */
public interface ExtensionValue {

  /**
   * Returns the tree form of this value. Callers may not rely on the returned node
   * being a fresh copy and must not mutate it.
   */
  JsonNode toTree();

  /**
   * Converts the tree back into {@code type} using Jackson data-binding.
   *
   * @throws IllegalArgumentException if the tree cannot be bound to {@code type}
   */
  default <T> T as(Class<T> type) {
    return ExtensionMappers.DEFAULT.convertValue(toTree(), type);
  }

  static ExtensionValue of(Object value) {
    return of(value, ExtensionMappers.DEFAULT);
  }

  static ExtensionValue of(Object value, ObjectMapper mapper) {
    Objects.requireNonNull(mapper, "mapper");
    if (value instanceof ExtensionValue extensionValue) {
      return extensionValue;
    }
    if (value == null) {
      return new TreeExtensionValue(NullNode.getInstance());
    }
    if (value instanceof JsonNode node) {
      return new TreeExtensionValue(node);
    }
    return new TreeExtensionValue(mapper.valueToTree(value));
  }
}
