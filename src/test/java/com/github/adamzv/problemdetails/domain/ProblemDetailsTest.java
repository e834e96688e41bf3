package com.github.adamzv.problemdetails.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProblemDetailsTest {

  record OutOfCredit(int balance, List<String> accounts) {}

  @Test
  void newProblemHasNoStandardMembers() {
    ProblemDetails problem = ProblemDetails.create();

    assertNull(problem.type());
    assertNull(problem.title());
    assertNull(problem.status());
    assertNull(problem.detail());
    assertNull(problem.instance());
    assertTrue(problem.extensions().isEmpty());
    assertEquals(ProblemDetails.ABOUT_BLANK, problem.effectiveType());
  }

  @Test
  void forStatusUsesReasonPhraseAsTitle() {
    ProblemDetails problem = ProblemDetails.forStatus(404);

    assertEquals(404, problem.status());
    assertEquals("Not Found", problem.title());
  }

  @Test
  void forStatusWithoutKnownReasonLeavesTitleAbsent() {
    assertNull(ProblemDetails.forStatus(599).title());
  }

  @Test
  void withMethodsDoNotChangeTheReceiver() {
    ProblemDetails original = ProblemDetails.of(400);

    ProblemDetails updated = original
        .withType("https://example.com/probs/out-of-credit")
        .withTitle("You do not have enough credit.")
        .withDetail("Your current balance is 30, but that costs 50.")
        .withInstance("/account/12345/msgs/abc")
        .withExtension("balance", 30);

    assertNull(original.type());
    assertNull(original.title());
    assertTrue(original.extensions().isEmpty());
    assertEquals(URI.create("https://example.com/probs/out-of-credit"), updated.type());
    assertEquals(URI.create("/account/12345/msgs/abc"), updated.instance());
    assertEquals(400, updated.status());
  }

  @Test
  void rejectsStatusOutsideHttpRange() {
    assertThrows(IllegalArgumentException.class, () -> ProblemDetails.of(99));
    assertThrows(IllegalArgumentException.class, () -> ProblemDetails.of(600));
  }

  @Test
  void rejectsEveryReservedNameAsExtension() {
    for (String reserved : ProblemMembers.RESERVED) {
      ProblemDetailsException exception = assertThrows(
          ProblemDetailsException.class,
          () -> ProblemDetails.create().withExtension(reserved, "x")
      );
      assertEquals(ErrorCodes.RESERVED_FIELD_COLLISION, exception.code());
      assertEquals(reserved, exception.error().details().get("name"));
    }
  }

  @Test
  void rejectsRepeatedExtensionName() {
    ProblemDetails problem = ProblemDetails.create().withExtension("trace_id", "abc123");

    ProblemDetailsException exception = assertThrows(
        ProblemDetailsException.class,
        () -> problem.withExtension("trace_id", "def456")
    );

    assertTrue(exception.is(ErrorCodes.DUPLICATE_EXTENSION_KEY));
    assertFalse(exception.is(ErrorCodes.RESERVED_FIELD_COLLISION));
    assertEquals("trace_id", exception.detail("name"));
    assertNull(exception.detail("format"));
    assertEquals("abc123", problem.extension("trace_id", String.class).orElseThrow());
  }

  @Test
  void errorRecordRequiresCodeAndCopiesDetails() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("name", "trace_id");

    DetailsError error = new DetailsError(ErrorCodes.DUPLICATE_EXTENSION_KEY, "duplicate", details);
    details.put("name", "changed");

    assertEquals("trace_id", error.details().get("name"));
    assertEquals(Map.of(), new DetailsError(ErrorCodes.NO_CODEC_AVAILABLE, "none", null).details());
    assertThrows(NullPointerException.class, () -> new DetailsError(null, "no code", Map.of()));
  }

  @Test
  void reservedNamesAreCaseSensitive() {
    ProblemDetails problem = ProblemDetails.create().withExtension("Status", "custom");

    assertTrue(problem.extensions().contains("Status"));
  }

  @Test
  void keepsExtensionInsertionOrder() {
    ProblemDetails problem = ProblemDetails.create()
        .withExtension("zeta", 1)
        .withExtension("alpha", 2)
        .withExtension("mid", 3);

    assertEquals(List.of("zeta", "alpha", "mid"), new ArrayList<>(problem.extensions().names()));
  }

  @Test
  void capturesExtensionValueAtInsertion() {
    List<String> accounts = new ArrayList<>(List.of("/account/12345"));
    ProblemDetails problem = ProblemDetails.create().withExtension("accounts", accounts);

    accounts.add("/account/67890");

    JsonNode stored = problem.extension("accounts").orElseThrow().toTree();
    assertEquals(1, stored.size());
  }

  @Test
  void flattensBeanPropertiesIntoExtensions() {
    ProblemDetails problem = ProblemDetails.create()
        .withExtensionsFrom(new OutOfCredit(30, List.of("/account/12345", "/account/67890")));

    assertEquals(List.of("balance", "accounts"), new ArrayList<>(problem.extensions().names()));
    assertEquals(30, problem.extension("balance", Integer.class).orElseThrow());
  }

  @Test
  void flatteningRejectsScalarBean() {
    assertThrows(IllegalArgumentException.class, () -> ProblemDetails.create().withExtensionsFrom("text"));
  }

  @Test
  void addsMapMembersInIterationOrder() {
    Map<String, Object> members = new LinkedHashMap<>();
    members.put("b", true);
    members.put("a", null);

    ProblemDetails problem = ProblemDetails.create().withExtensions(members);

    assertEquals(List.of("b", "a"), new ArrayList<>(problem.extensions().names()));
    assertTrue(problem.extension("a").orElseThrow().toTree().isNull());
  }

  @Test
  void mapWithReservedNameFailsWithoutPartialResult() {
    ProblemDetails problem = ProblemDetails.create();

    assertThrows(ProblemDetailsException.class, () -> problem.withExtensions(Map.of("detail", "x")));
    assertTrue(problem.extensions().isEmpty());
  }

  @Test
  void equalityCoversExtensions() {
    ProblemDetails first = ProblemDetails.of(404).withExtension("trace_id", "abc123");
    ProblemDetails second = ProblemDetails.of(404).withExtension("trace_id", "abc123");
    ProblemDetails other = ProblemDetails.of(404).withExtension("trace_id", "zzz");

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, other);
  }

  @Test
  void customExtensionValueIsStoredAsIs() {
    ExtensionValue custom = () -> com.fasterxml.jackson.databind.node.TextNode.valueOf("custom");

    ProblemDetails problem = ProblemDetails.create().withExtension("kind", custom);

    assertEquals("custom", problem.extension("kind", String.class).orElseThrow());
  }

  @Test
  void missingExtensionIsEmpty() {
    assertFalse(ProblemDetails.create().extension("nope", String.class).isPresent());
  }
}
