package com.github.adamzv.problemdetails.adapters.xml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;

/**
 * {@code application/problem+xml}, following appendix B of RFC 9457.
 *
 * <p>Extension members become child elements named after the member: scalars as text,
 * objects as nested elements, arrays as one repeated element per item and {@code null}
 * as an empty element marked {@code xsi:nil}. Text holding characters XML 1.0 cannot carry
 * is refused with {@code UNREPRESENTABLE_MEMBER}. XML has no scalar types, so decoded
 * extension scalars are always strings and a one-item array decodes as its single item.
 */
public class XmlProblemCodec implements ProblemCodec {

  public static final String NAMESPACE = "urn:ietf:rfc:7807";
  public static final String ROOT_ELEMENT = "problem";

  static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
  static final String ARRAY_ITEM_ELEMENT = "i";

  private static final Pattern STATUS_PATTERN = Pattern.compile("[1-5][0-9]{2}");

  private final XMLOutputFactory outputFactory;
  private final XMLInputFactory inputFactory;

  public XmlProblemCodec() {
    this.outputFactory = XMLOutputFactory.newFactory();
    this.inputFactory = XMLInputFactory.newFactory();
    inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
    inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
  }

  @Override
  public ProblemFormat format() {
    return ProblemFormat.XML;
  }

  @Override
  public byte[] encode(ProblemDetails problem) {
    Objects.requireNonNull(problem, "problem");
    for (String name : problem.extensions().names()) {
      if (!XmlNames.isElementName(name)) {
        throw DetailsErrors.unrepresentableMember(name, "XML");
      }
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try {
      XMLStreamWriter xmlWriter = outputFactory.createXMLStreamWriter(out, "UTF-8");
      xmlWriter.writeStartDocument("UTF-8", "1.0");
      xmlWriter.writeStartElement(ROOT_ELEMENT);
      xmlWriter.writeDefaultNamespace(NAMESPACE);
      if (problem.type() != null) {
        writeText(xmlWriter, ProblemMembers.TYPE, problem.type().toString());
      }
      if (problem.title() != null) {
        writeText(xmlWriter, ProblemMembers.TITLE, problem.title());
      }
      if (problem.status() != null) {
        writeText(xmlWriter, ProblemMembers.STATUS, problem.status().toString());
      }
      if (problem.detail() != null) {
        writeText(xmlWriter, ProblemMembers.DETAIL, problem.detail());
      }
      if (problem.instance() != null) {
        writeText(xmlWriter, ProblemMembers.INSTANCE, problem.instance().toString());
      }
      for (Map.Entry<String, ExtensionValue> member : problem.extensions()) {
        writeMember(xmlWriter, member.getKey(), member.getValue().toTree());
      }
      xmlWriter.writeEndElement();
      xmlWriter.writeEndDocument();
      xmlWriter.flush();
      xmlWriter.close();
    } catch (XMLStreamException ex) {
      throw new IllegalStateException("Failed to write problem details as XML", ex);
    }
    return out.toByteArray();
  }

  private void writeText(XMLStreamWriter xmlWriter, String name, String text) throws XMLStreamException {
    xmlWriter.writeStartElement(name);
    writeCharacters(xmlWriter, name, text);
    xmlWriter.writeEndElement();
  }

  /**
   * Writes {@code text} so that a parser reads back exactly the same characters: carriage
   * returns go out as {@code &#13;} because parsers normalize literal line breaks.
   */
  private void writeCharacters(XMLStreamWriter xmlWriter, String name, String text) throws XMLStreamException {
    if (!XmlNames.isXmlText(text)) {
      throw DetailsErrors.unrepresentableMember(name, "XML");
    }
    int start = 0;
    for (int i = text.indexOf('\r'); i >= 0; i = text.indexOf('\r', start)) {
      xmlWriter.writeCharacters(text.substring(start, i));
      xmlWriter.writeEntityRef("#13");
      start = i + 1;
    }
    xmlWriter.writeCharacters(text.substring(start));
  }

  private void writeMember(XMLStreamWriter xmlWriter, String name, JsonNode value) throws XMLStreamException {
    if (value.isArray()) {
      for (JsonNode item : value) {
        writeArrayItem(xmlWriter, name, item);
      }
      return;
    }
    xmlWriter.writeStartElement(name);
    writeContent(xmlWriter, name, value);
    xmlWriter.writeEndElement();
  }

  private void writeArrayItem(XMLStreamWriter xmlWriter, String name, JsonNode item) throws XMLStreamException {
    if (!item.isArray()) {
      writeMember(xmlWriter, name, item);
      return;
    }
    // arrays nested in arrays keep their boundary through a wrapping element
    xmlWriter.writeStartElement(name);
    for (JsonNode nested : item) {
      writeArrayItem(xmlWriter, ARRAY_ITEM_ELEMENT, nested);
    }
    xmlWriter.writeEndElement();
  }

  private void writeContent(XMLStreamWriter xmlWriter, String name, JsonNode value) throws XMLStreamException {
    if (value.isNull() || value.isMissingNode()) {
      xmlWriter.writeNamespace("xsi", XSI_NAMESPACE);
      xmlWriter.writeAttribute("xsi", XSI_NAMESPACE, "nil", "true");
      return;
    }
    if (value.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> field = it.next();
        if (!XmlNames.isElementName(field.getKey())) {
          throw DetailsErrors.unrepresentableMember(field.getKey(), "XML");
        }
        writeMember(xmlWriter, field.getKey(), field.getValue());
      }
      return;
    }
    writeCharacters(xmlWriter, name, value.asText());
  }

  @Override
  public ProblemDetails decode(byte[] document) {
    Objects.requireNonNull(document, "document");
    try {
      XMLStreamReader reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(document));
      try {
        return readDocument(reader);
      } finally {
        reader.close();
      }
    } catch (XMLStreamException ex) {
      throw DetailsErrors.malformedDocument(
          "Problem details document is not well-formed XML",
          Map.of("error", String.valueOf(ex.getMessage())),
          ex
      );
    }
  }

  private ProblemDetails readDocument(XMLStreamReader reader) throws XMLStreamException {
    reader.nextTag();
    if (!ROOT_ELEMENT.equals(reader.getLocalName()) || !NAMESPACE.equals(reader.getNamespaceURI())) {
      throw DetailsErrors.malformedDocument(
          "Root element must be {" + NAMESPACE + "}" + ROOT_ELEMENT,
          Map.of("root", "{" + String.valueOf(reader.getNamespaceURI()) + "}" + reader.getLocalName()),
          null
      );
    }

    Map<String, JsonNode> fixed = new LinkedHashMap<>();
    Map<String, JsonNode> members = new LinkedHashMap<>();
    while (reader.nextTag() == XMLStreamConstants.START_ELEMENT) {
      String name = reader.getLocalName();
      JsonNode value = readElement(reader);
      if (ProblemMembers.isReserved(name)) {
        if (fixed.putIfAbsent(name, value) != null) {
          throw DetailsErrors.malformedDocument(
              "Standard member appears more than once",
              Map.of("member", name),
              null
          );
        }
      } else {
        appendChild(members, name, value);
      }
    }
    while (reader.hasNext()) {
      reader.next();
    }

    ProblemDetails problem = ProblemDetails.create();
    for (Map.Entry<String, JsonNode> field : fixed.entrySet()) {
      JsonNode value = field.getValue();
      if (value.isNull()) {
        continue;
      }
      problem = switch (field.getKey()) {
        case ProblemMembers.TYPE -> problem.withType(uri(field.getKey(), value));
        case ProblemMembers.TITLE -> problem.withTitle(text(field.getKey(), value));
        case ProblemMembers.STATUS -> problem.withStatus(status(value));
        case ProblemMembers.DETAIL -> problem.withDetail(text(field.getKey(), value));
        case ProblemMembers.INSTANCE -> problem.withInstance(uri(field.getKey(), value));
        default -> throw new IllegalStateException("Unhandled reserved member " + field.getKey());
      };
    }
    Extensions extensions = Extensions.empty();
    for (Map.Entry<String, JsonNode> member : members.entrySet()) {
      extensions = extensions.with(member.getKey(), new TreeExtensionValue(member.getValue()));
    }
    return problem.withExtensions(extensions);
  }

  /**
   * Reads the element the reader is positioned on, leaving the reader on its end tag.
   */
  private JsonNode readElement(XMLStreamReader reader) throws XMLStreamException {
    boolean nil = "true".equals(reader.getAttributeValue(XSI_NAMESPACE, "nil"));
    StringBuilder text = new StringBuilder();
    Map<String, JsonNode> children = null;
    while (true) {
      int event = reader.next();
      if (event == XMLStreamConstants.START_ELEMENT) {
        if (children == null) {
          children = new LinkedHashMap<>();
        }
        String name = reader.getLocalName();
        appendChild(children, name, readElement(reader));
      } else if (event == XMLStreamConstants.CHARACTERS
          || event == XMLStreamConstants.CDATA
          || event == XMLStreamConstants.SPACE) {
        text.append(reader.getText());
      } else if (event == XMLStreamConstants.END_ELEMENT) {
        break;
      }
    }

    JsonNodeFactory nodes = JsonNodeFactory.instance;
    if (nil) {
      return nodes.nullNode();
    }
    if (children == null) {
      return nodes.textNode(text.toString());
    }
    ObjectNode object = nodes.objectNode();
    children.forEach(object::set);
    return object;
  }

  private static void appendChild(Map<String, JsonNode> siblings, String name, JsonNode value) {
    JsonNode existing = siblings.get(name);
    if (existing == null) {
      siblings.put(name, value);
    } else if (existing.isArray()) {
      ((ArrayNode) existing).add(value);
    } else {
      ArrayNode items = JsonNodeFactory.instance.arrayNode();
      items.add(existing);
      items.add(value);
      siblings.put(name, items);
    }
  }

  private static String text(String member, JsonNode value) {
    if (!value.isTextual()) {
      throw DetailsErrors.typeMismatch(member, "text content");
    }
    return value.textValue();
  }

  private static URI uri(String member, JsonNode value) {
    try {
      return new URI(text(member, value).trim());
    } catch (URISyntaxException ex) {
      throw DetailsErrors.typeMismatch(member, "a URI reference");
    }
  }

  private static int status(JsonNode value) {
    String text = text(ProblemMembers.STATUS, value).trim();
    if (!STATUS_PATTERN.matcher(text).matches()) {
      throw DetailsErrors.typeMismatch(ProblemMembers.STATUS,
          "an integer between " + ProblemDetails.MIN_STATUS + " and " + ProblemDetails.MAX_STATUS);
    }
    return Integer.parseInt(text);
  }
}
