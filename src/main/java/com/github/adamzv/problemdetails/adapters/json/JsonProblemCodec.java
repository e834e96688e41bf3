package com.github.adamzv.problemdetails.adapters.json;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.github.adamzv.problemdetails.domain.DetailsErrors;
import com.github.adamzv.problemdetails.domain.ExtensionValue;
import com.github.adamzv.problemdetails.domain.Extensions;
import com.github.adamzv.problemdetails.domain.ProblemDetails;
import com.github.adamzv.problemdetails.domain.ProblemFormat;
import com.github.adamzv.problemdetails.domain.ProblemMembers;
import com.github.adamzv.problemdetails.domain.TreeExtensionValue;
import com.github.adamzv.problemdetails.ports.ProblemCodec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * {@code application/problem+json}. Standard members are written first, in RFC order,
 * followed by extension members in insertion order. Absent members are left out.
 */
public class JsonProblemCodec implements ProblemCodec {

  private final ObjectMapper objectMapper;
  private final ObjectReader reader;

  public JsonProblemCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.reader = objectMapper.reader()
        .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  @Override
  public ProblemFormat format() {
    return ProblemFormat.JSON;
  }

  @Override
  public byte[] encode(ProblemDetails problem) {
    Objects.requireNonNull(problem, "problem");
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator generator = objectMapper.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
      generator.writeStartObject();
      if (problem.type() != null) {
        generator.writeStringField(ProblemMembers.TYPE, problem.type().toString());
      }
      if (problem.title() != null) {
        generator.writeStringField(ProblemMembers.TITLE, problem.title());
      }
      if (problem.status() != null) {
        generator.writeNumberField(ProblemMembers.STATUS, problem.status());
      }
      if (problem.detail() != null) {
        generator.writeStringField(ProblemMembers.DETAIL, problem.detail());
      }
      if (problem.instance() != null) {
        generator.writeStringField(ProblemMembers.INSTANCE, problem.instance().toString());
      }
      for (Map.Entry<String, ExtensionValue> member : problem.extensions()) {
        generator.writeFieldName(member.getKey());
        objectMapper.writeTree(generator, member.getValue().toTree());
      }
      generator.writeEndObject();
    } catch (IOException ex) {
      // only reachable through a misbehaving generator, the sink is in memory
      throw new UncheckedIOException("Failed to write problem details as JSON", ex);
    }
    return out.toByteArray();
  }

  @Override
  public ProblemDetails decode(byte[] document) {
    Objects.requireNonNull(document, "document");
    JsonNode root = readRoot(document);
    if (root == null || !root.isObject()) {
      throw DetailsErrors.malformedDocument(
          "Problem details document must be a JSON object",
          Map.of("nodeType", root == null ? "MISSING" : root.getNodeType().name()),
          null
      );
    }

    ProblemDetails problem = ProblemDetails.create();
    Extensions extensions = Extensions.empty();
    for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> member = it.next();
      String name = member.getKey();
      JsonNode value = member.getValue();
      if (!ProblemMembers.isReserved(name)) {
        extensions = extensions.with(name, new TreeExtensionValue(value));
        continue;
      }
      if (value.isNull()) {
        continue;
      }
      problem = switch (name) {
        case ProblemMembers.TYPE -> problem.withType(uri(name, value));
        case ProblemMembers.TITLE -> problem.withTitle(text(name, value));
        case ProblemMembers.STATUS -> problem.withStatus(status(value));
        case ProblemMembers.DETAIL -> problem.withDetail(text(name, value));
        case ProblemMembers.INSTANCE -> problem.withInstance(uri(name, value));
        default -> throw new IllegalStateException("Unhandled reserved member " + name);
      };
    }
    return problem.withExtensions(extensions);
  }

  private JsonNode readRoot(byte[] document) {
    try {
      return reader.readTree(new ByteArrayInputStream(document));
    } catch (JsonProcessingException ex) {
      throw DetailsErrors.malformedDocument(
          "Problem details document is not valid JSON",
          Map.of("error", String.valueOf(ex.getOriginalMessage())),
          ex
      );
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read problem details JSON", ex);
    }
  }

  private static String text(String member, JsonNode value) {
    if (!value.isTextual()) {
      throw DetailsErrors.typeMismatch(member, "a string");
    }
    return value.textValue();
  }

  private static URI uri(String member, JsonNode value) {
    String text = text(member, value);
    try {
      return new URI(text);
    } catch (URISyntaxException ex) {
      throw DetailsErrors.typeMismatch(member, "a URI reference");
    }
  }

  private static int status(JsonNode value) {
    if (!value.isIntegralNumber() || !value.canConvertToInt()
        || !ProblemDetails.isValidStatus(value.intValue())) {
      throw DetailsErrors.typeMismatch(ProblemMembers.STATUS,
          "an integer between " + ProblemDetails.MIN_STATUS + " and " + ProblemDetails.MAX_STATUS);
    }
    return value.intValue();
  }
}
