package com.github.adamzv.problemdetails.domain;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered store of extension members. Every insertion returns
 * a new store; reserved and repeated names are rejected instead of overwritten.
 */
public final class Extensions implements Iterable<Map.Entry<String, ExtensionValue>> {

  private static final Extensions EMPTY = new Extensions(Collections.emptyMap());

  private final Map<String, ExtensionValue> members;

  private Extensions(Map<String, ExtensionValue> members) {
    this.members = members;
  }

  public static Extensions empty() {
    return EMPTY;
  }

  public Extensions with(String name, ExtensionValue value) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    if (ProblemMembers.isReserved(name)) {
      throw DetailsErrors.reservedFieldCollision(name);
    }
    if (members.containsKey(name)) {
      throw DetailsErrors.duplicateExtensionKey(name);
    }
    Map<String, ExtensionValue> copy = new LinkedHashMap<>(members);
    copy.put(name, value);
    return new Extensions(Collections.unmodifiableMap(copy));
  }

  public Optional<ExtensionValue> get(String name) {
    return Optional.ofNullable(members.get(name));
  }

  public boolean contains(String name) {
    return members.containsKey(name);
  }

  public Set<String> names() {
    return members.keySet();
  }

  public Map<String, ExtensionValue> asMap() {
    return members;
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  @Override
  public Iterator<Map.Entry<String, ExtensionValue>> iterator() {
    return members.entrySet().iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Extensions other)) {
      return false;
    }
    return members.equals(other.members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return members.toString();
  }
}
