package com.github.adamzv.problemdetails.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An RFC 9457 problem details object.
 *
 * <p>Every standard member is optional and {@code null} when absent. Instances are
 * immutable: each {@code with*} method returns a new value and leaves the receiver
 * untouched, so a problem can be shared freely between threads once built.
 *
 * <pre>{@code
 * ProblemDetails problem = ProblemDetails.forStatus(404)
 *     .withDetail("Order 42 does not exist")
 *     .withExtension("trace_id", traceId);
 * }</pre>
 *
 * @param type URI reference identifying the problem type; absent means {@code about:blank}
 * @param title short summary of the problem type
 * @param status HTTP status code, 100 to 599
 * @param detail explanation specific to this occurrence
 * @param instance URI reference identifying this occurrence
 * @param extensions additional members, in insertion order
 */
public record ProblemDetails(
    URI type,
    String title,
    Integer status,
    String detail,
    URI instance,
    Extensions extensions
) {

  public static final URI ABOUT_BLANK = URI.create("about:blank");

  public static final int MIN_STATUS = 100;
  public static final int MAX_STATUS = 599;

  public ProblemDetails {
    if (status != null && !isValidStatus(status)) {
      throw new IllegalArgumentException("status must be between " + MIN_STATUS + " and " + MAX_STATUS
          + ", was " + status);
    }
    extensions = extensions != null ? extensions : Extensions.empty();
  }

  public static ProblemDetails create() {
    return new ProblemDetails(null, null, null, null, null, Extensions.empty());
  }

  public static ProblemDetails of(int status) {
    return create().withStatus(status);
  }

  /**
   * Problem with the given status and its standard reason phrase as title, when one is known.
   */
  public static ProblemDetails forStatus(int status) {
    return of(status).withTitle(StatusTitles.titleFor(status).orElse(null));
  }

  public static boolean isValidStatus(int status) {
    return status >= MIN_STATUS && status <= MAX_STATUS;
  }

  public ProblemDetails withType(URI type) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public ProblemDetails withType(String type) {
    return withType(type != null ? URI.create(type) : null);
  }

  public ProblemDetails withTitle(String title) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public ProblemDetails withStatus(Integer status) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public ProblemDetails withDetail(String detail) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public ProblemDetails withInstance(URI instance) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public ProblemDetails withInstance(String instance) {
    return withInstance(instance != null ? URI.create(instance) : null);
  }

  /**
   * Adds an extension member. The value is captured now, later changes to {@code value}
   * are not reflected in this problem.
   *
   * @throws ProblemDetailsException {@code RESERVED_FIELD_COLLISION} when {@code name} is a
   *     standard member, {@code DUPLICATE_EXTENSION_KEY} when it was added before
   */
  public ProblemDetails withExtension(String name, Object value) {
    return withExtensions(extensions.with(name, ExtensionValue.of(value)));
  }

  public ProblemDetails withExtension(String name, Object value, ObjectMapper mapper) {
    return withExtensions(extensions.with(name, ExtensionValue.of(value, mapper)));
  }

  /**
   * Adds every entry of {@code members} in iteration order, with the same rules as
   * {@link #withExtension(String, Object)}.
   */
  public ProblemDetails withExtensions(Map<String, ?> members) {
    Extensions updated = extensions;
    for (Map.Entry<String, ?> entry : members.entrySet()) {
      updated = updated.with(entry.getKey(), ExtensionValue.of(entry.getValue()));
    }
    return withExtensions(updated);
  }

  /**
   * Flattens the properties of {@code bean} into extension members, in the order Jackson
   * serializes them.
   *
   * @throws IllegalArgumentException if {@code bean} does not serialize to a JSON object
   */
  public ProblemDetails withExtensionsFrom(Object bean) {
    JsonNode tree = ExtensionValue.of(bean).toTree();
    if (!tree.isObject()) {
      throw new IllegalArgumentException("Extension bean must serialize to an object, got "
          + tree.getNodeType());
    }
    Extensions updated = extensions;
    for (Iterator<Map.Entry<String, JsonNode>> it = tree.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      updated = updated.with(field.getKey(), new TreeExtensionValue(field.getValue()));
    }
    return withExtensions(updated);
  }

  public ProblemDetails withExtensions(Extensions extensions) {
    return new ProblemDetails(type, title, status, detail, instance, extensions);
  }

  public URI effectiveType() {
    return type != null ? type : ABOUT_BLANK;
  }

  public Optional<ExtensionValue> extension(String name) {
    return extensions.get(name);
  }

  public <T> Optional<T> extension(String name, Class<T> valueType) {
    Objects.requireNonNull(valueType, "valueType");
    return extensions.get(name).map(value -> value.as(valueType));
  }
}
