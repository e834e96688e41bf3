package com.github.adamzv.problemdetails.domain;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Extension value backed by a private copy of a Jackson tree. This is also what
 * the codecs produce when decoding.
 */
public record TreeExtensionValue(JsonNode tree) implements ExtensionValue {

  public TreeExtensionValue {
    tree = Objects.requireNonNull(tree, "tree").deepCopy();
  }

  @Override
  public JsonNode tree() {
    return tree.deepCopy();
  }

  @Override
  public JsonNode toTree() {
    return tree;
  }

  @Override
  public String toString() {
    return tree.toString();
  }
}
