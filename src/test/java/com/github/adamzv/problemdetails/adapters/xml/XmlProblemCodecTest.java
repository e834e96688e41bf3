package com.github.adamzv.problemdetails.adapters.xml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.adamzv.problemdetails.domain.ErrorCodes;
import com.github.adamzv.problemdetails.domain.ProblemDetails;
import com.github.adamzv.problemdetails.domain.ProblemDetailsException;
import com.github.adamzv.problemdetails.domain.ProblemFormat;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class XmlProblemCodecTest {

  private static final String OPEN = "<problem xmlns=\"urn:ietf:rfc:7807\">";

  private final XmlProblemCodec codec = new XmlProblemCodec();

  @Test
  void advertisesProblemXml() {
    assertEquals(ProblemFormat.XML, codec.format());
    assertEquals("application/problem+xml", codec.contentType());
  }

  @Test
  void encodesStandardMembersBeforeExtensions() {
    ProblemDetails problem = ProblemDetails.create()
        .withExtension("trace_id", "abc123")
        .withStatus(404)
        .withTitle("Not Found");

    String xml = encode(problem);

    assertTrue(xml.startsWith("<?xml"));
    assertTrue(
        xml.endsWith(OPEN + "<title>Not Found</title><status>404</status><trace_id>abc123</trace_id></problem>"),
        xml
    );
  }

  @Test
  void leavesOutAbsentMembers() {
    String xml = encode(ProblemDetails.create().withDetail("only detail"));

    assertTrue(xml.endsWith(OPEN + "<detail>only detail</detail></problem>"), xml);
  }

  @Test
  void escapesText() {
    String xml = encode(ProblemDetails.create().withDetail("a < b & c"));

    assertTrue(xml.contains("<detail>a &lt; b &amp; c</detail>"), xml);
    assertEquals("a < b & c", codec.decode(xml.getBytes(StandardCharsets.UTF_8)).detail());
  }

  @Test
  void writesStructuredExtensionsAsElements() {
    Map<String, Object> limits = new LinkedHashMap<>();
    limits.put("max", 50);
    limits.put("unit", "EUR");
    ProblemDetails problem = ProblemDetails.create()
        .withExtension("balance", 30)
        .withExtension("accounts", List.of("/account/12345", "/account/67890"))
        .withExtension("limits", limits);

    String xml = encode(problem);

    assertTrue(xml.contains(
        "<balance>30</balance>"
            + "<accounts>/account/12345</accounts><accounts>/account/67890</accounts>"
            + "<limits><max>50</max><unit>EUR</unit></limits>"), xml);
  }

  @Test
  void extensionOrderFollowsInsertion() {
    ProblemDetails problem = ProblemDetails.of(409)
        .withExtension("zeta", "z")
        .withExtension("alpha", "a")
        .withExtension("mid", "m");

    String xml = encode(problem);

    assertTrue(xml.contains("<status>409</status><zeta>z</zeta><alpha>a</alpha><mid>m</mid>"), xml);
    ProblemDetails decoded = codec.decode(codec.encode(problem));
    assertEquals(List.of("zeta", "alpha", "mid"), new ArrayList<>(decoded.extensions().names()));
  }

  @Test
  void roundTripsStandardMembers() {
    ProblemDetails problem = ProblemDetails.create()
        .withType("https://example.com/probs/out-of-credit")
        .withTitle("You do not have enough credit.")
        .withStatus(403)
        .withDetail("Your current balance is 30, but that costs 50.")
        .withInstance("/account/12345/msgs/abc");

    assertEquals(problem, codec.decode(codec.encode(problem)));
  }

  @Test
  void roundTripsStringExtensions() {
    ProblemDetails problem = ProblemDetails.forStatus(404).withExtension("trace_id", "abc123");

    assertEquals(problem, codec.decode(codec.encode(problem)));
  }

  @Test
  void keepsCarriageReturnsThroughRoundTrip() {
    ProblemDetails problem = ProblemDetails.of(400)
        .withDetail("line1\r\nline2\rline3")
        .withExtension("note", "a\r\nb");

    String xml = encode(problem);

    assertTrue(xml.contains("<detail>line1&#13;\nline2&#13;line3</detail>"), xml);
    assertEquals(problem, codec.decode(codec.encode(problem)));
  }

  @Test
  void keepsWhitespaceOnlyText() {
    ProblemDetails problem = ProblemDetails.create()
        .withDetail("  ")
        .withExtension("padding", " \t ");

    assertEquals(problem, codec.decode(codec.encode(problem)));
  }

  @Test
  void refusesCharactersXmlCannotCarry() {
    ProblemDetails badTitle = ProblemDetails.create().withTitle("bad\u0001char");
    ProblemDetails badExtension = ProblemDetails.create().withExtension("note", Map.of("text", "bell\u0007"));
    ProblemDetails loneSurrogate = ProblemDetails.create().withDetail("half \uD800 pair");

    ProblemDetailsException title = assertThrows(ProblemDetailsException.class, () -> codec.encode(badTitle));
    ProblemDetailsException extension = assertThrows(ProblemDetailsException.class, () -> codec.encode(badExtension));
    ProblemDetailsException detail = assertThrows(ProblemDetailsException.class, () -> codec.encode(loneSurrogate));

    assertTrue(title.is(ErrorCodes.UNREPRESENTABLE_MEMBER));
    assertEquals("title", title.detail("name"));
    assertEquals("text", extension.detail("name"));
    assertEquals(ErrorCodes.UNREPRESENTABLE_MEMBER, detail.code());
  }

  @Test
  void leavesOutEmptyArrays() {
    ProblemDetails problem = ProblemDetails.of(400).withExtension("errors", List.of());

    String xml = encode(problem);

    assertFalse(xml.contains("errors"), xml);
    assertFalse(codec.decode(codec.encode(problem)).extensions().contains("errors"));
  }

  @Test
  void decodesEmptyObjectAsEmptyText() {
    ProblemDetails decoded = codec.decode(codec.encode(ProblemDetails.create().withExtension("context", Map.of())));

    JsonNode context = decoded.extension("context").orElseThrow().toTree();
    assertTrue(context.isTextual());
    assertEquals("", context.textValue());
  }

  @Test
  void wrapsArraysNestedInArrays() {
    ProblemDetails problem = ProblemDetails.create().withExtension("grid", List.of(List.of("a", "b"), "c"));

    String xml = encode(problem);

    assertTrue(xml.contains("<grid><i>a</i><i>b</i></grid><grid>c</grid>"), xml);
    JsonNode grid = codec.decode(codec.encode(problem)).extension("grid").orElseThrow().toTree();
    assertTrue(grid.isArray());
    assertEquals(2, grid.size());
    assertEquals("b", grid.get(0).get("i").get(1).asText());
    assertEquals("c", grid.get(1).asText());
  }

  @Test
  void decodesScalarsAsTextAndRepeatedElementsAsArray() {
    ProblemDetails problem = codec.decode(codec.encode(ProblemDetails.create()
        .withExtension("balance", 30)
        .withExtension("accounts", List.of("/a", "/b"))
        .withExtension("missing", null)));

    JsonNode balance = problem.extension("balance").orElseThrow().toTree();
    assertTrue(balance.isTextual());
    assertEquals("30", balance.textValue());
    JsonNode accounts = problem.extension("accounts").orElseThrow().toTree();
    assertTrue(accounts.isArray());
    assertEquals(2, accounts.size());
    assertTrue(problem.extension("missing").orElseThrow().toTree().isNull());
  }

  @Test
  void decodesNestedElementsAsObject() {
    ProblemDetails problem = decode(OPEN
        + "<status>400</status>"
        + "<errors><field>name</field><reason>blank</reason></errors>"
        + "<errors><field>email</field><reason>invalid</reason></errors>"
        + "</problem>");

    JsonNode errors = problem.extension("errors").orElseThrow().toTree();
    assertEquals(2, errors.size());
    assertEquals("email", errors.get(1).get("field").asText());
  }

  @Test
  void rejectsExtensionNamesThatAreNotElementNames() {
    ProblemDetails problem = ProblemDetails.create().withExtension("trace id", "x");

    ProblemDetailsException exception = assertThrows(ProblemDetailsException.class, () -> codec.encode(problem));

    assertEquals(ErrorCodes.UNREPRESENTABLE_MEMBER, exception.code());
  }

  @Test
  void rejectsWrongRoot() {
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, "<error xmlns=\"urn:ietf:rfc:7807\"><title>x</title></error>");
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, "<problem><title>x</title></problem>");
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, "<problem xmlns=\"urn:example\"><title>x</title></problem>");
  }

  @Test
  void rejectsMalformedXml() {
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, OPEN + "<title>x</problem>");
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, "{\"title\":\"json\"}");
    assertErrorCode(ErrorCodes.MALFORMED_DOCUMENT, OPEN + "<title>a</title><title>b</title></problem>");
  }

  @Test
  void rejectsDocumentTypeDeclarations() {
    assertErrorCode(
        ErrorCodes.MALFORMED_DOCUMENT,
        "<?xml version=\"1.0\"?><!DOCTYPE problem [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>"
            + OPEN + "<detail>&xxe;</detail></problem>"
    );
  }

  @Test
  void rejectsWronglyTypedStandardMembers() {
    assertErrorCode(ErrorCodes.TYPE_MISMATCH, OPEN + "<status>abc</status></problem>");
    assertErrorCode(ErrorCodes.TYPE_MISMATCH, OPEN + "<status>700</status></problem>");
    assertErrorCode(ErrorCodes.TYPE_MISMATCH, OPEN + "<title><b>bold</b></title></problem>");
    assertErrorCode(ErrorCodes.TYPE_MISMATCH, OPEN + "<instance>not a uri</instance></problem>");
  }

  @Test
  void acceptsPrefixedNamespace() {
    ProblemDetails problem = decode("<p:problem xmlns:p=\"urn:ietf:rfc:7807\"><p:status>503</p:status></p:problem>");

    assertEquals(503, problem.status());
    assertFalse(problem.extensions().contains("status"));
  }

  private String encode(ProblemDetails problem) {
    return new String(codec.encode(problem), StandardCharsets.UTF_8);
  }

  private ProblemDetails decode(String xml) {
    return codec.decode(xml.getBytes(StandardCharsets.UTF_8));
  }

  private void assertErrorCode(String code, String xml) {
    ProblemDetailsException exception = assertThrows(ProblemDetailsException.class, () -> decode(xml));
    assertEquals(code, exception.code(), xml);
  }
}
