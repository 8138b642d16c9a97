package io.github.eprintharvester.paginator;

import io.github.eprintharvester.helper.ArtifactNames;
import io.github.eprintharvester.model.CatalogPage;
import io.github.eprintharvester.model.ImmutableCatalogPage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.inject.Inject;
import javax.inject.Singleton;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Parses an OAI-PMH ListRecords response into a {@link CatalogPage}.
 */
@Singleton
public class OaiListRecordsParser {

  /**
   * OAI-PMH 2.0 namespace.
   */
  public static final String OAI_NS = "http://www.openarchives.org/OAI/2.0/";

  /**
   * Maximum number of body characters logged when the body is not XML.
   */
  public static final int SNIPPET_LENGTH = 500;

  private static final String NO_RECORDS_MATCH = "noRecordsMatch";

  private static final Logger log = LoggerFactory.getLogger(OaiListRecordsParser.class);

  private final DocumentBuilderFactory documentBuilderFactory;

  /**
   * Instantiates a new Oai list records parser.
   */
  @Inject
  public OaiListRecordsParser() {
    this.documentBuilderFactory = secureFactory();
  }

  /**
   * Parse a response body. Never throws on malformed input; returns {@link
   * CatalogPage#malformedPage()} instead.
   *
   * @param body the raw body
   * @return the catalog page
   */
  public CatalogPage parse(final byte[] body) {
    final Document document;
    try {
      final DocumentBuilder builder = documentBuilderFactory.newDocumentBuilder();
      builder.setErrorHandler(new DefaultHandler());
      document = builder.parse(new ByteArrayInputStream(body));
    } catch (SAXException | IOException | ParserConfigurationException e) {
      log.warn("Non-XML listing response ({}). Snippet:\n{}", e.getMessage(), snippet(body));
      return CatalogPage.malformedPage();
    }

    logProtocolErrors(document);

    final ImmutableCatalogPage.Builder page = ImmutableCatalogPage.builder();
    final NodeList records = document.getElementsByTagNameNS(OAI_NS, "record");
    for (int i = 0; i < records.getLength(); i++) {
      final Element header = firstChild((Element) records.item(i), "header");
      if (header == null) {
        continue;
      }
      if ("deleted".equals(header.getAttribute("status"))) {
        continue;
      }
      final Element identifier = firstChild(header, "identifier");
      final String id =
          ArtifactNames.trailingComponent(identifier == null ? "" : identifier.getTextContent());
      if (!id.isEmpty()) {
        page.addIdentifiers(id);
      }
    }

    final NodeList tokens = document.getElementsByTagNameNS(OAI_NS, "resumptionToken");
    if (tokens.getLength() > 0) {
      final String token = tokens.item(0).getTextContent();
      if (token != null && !token.isBlank()) {
        page.nextCursor(token.trim());
      }
    }
    return page.build();
  }

  private void logProtocolErrors(final Document document) {
    final NodeList errors = document.getElementsByTagNameNS(OAI_NS, "error");
    for (int i = 0; i < errors.getLength(); i++) {
      final Element error = (Element) errors.item(i);
      final String code = error.getAttribute("code");
      if (NO_RECORDS_MATCH.equals(code)) {
        log.info("Catalog reports no matching records");
      } else {
        log.warn("Catalog protocol error {}: {}", code, error.getTextContent().trim());
      }
    }
  }

  private static Element firstChild(final Element parent, final String localName) {
    for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
      if (node.getNodeType() == Node.ELEMENT_NODE
          && OAI_NS.equals(node.getNamespaceURI())
          && localName.equals(node.getLocalName())) {
        return (Element) node;
      }
    }
    return null;
  }

  /**
   * At most {@link #SNIPPET_LENGTH} characters from the start of the body. Only a bounded prefix
   * is decoded.
   *
   * @param body the raw body
   * @return the snippet
   */
  static String snippet(final byte[] body) {
    final byte[] prefix = Arrays.copyOf(body, Math.min(body.length, SNIPPET_LENGTH * 4));
    final String text = new String(prefix, StandardCharsets.UTF_8);
    return text.length() <= SNIPPET_LENGTH ? text : text.substring(0, SNIPPET_LENGTH);
  }

  private static DocumentBuilderFactory secureFactory() {
    final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setExpandEntityReferences(false);
    factory.setXIncludeAware(false);
    try {
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
    return factory;
  }
}
