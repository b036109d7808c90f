package com.flamingo.ai.reportextract.service.parsing;

import com.flamingo.ai.reportextract.exception.DocumentReadException;
import com.flamingo.ai.reportextract.service.parsing.model.ContentNode;
import com.flamingo.ai.reportextract.service.parsing.model.ParagraphNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableCellNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableNode;
import com.flamingo.ai.reportextract.service.parsing.model.TableRowNode;
import com.flamingo.ai.reportextract.service.parsing.model.UnsupportedNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@link DocumentParser} for word-processing formats without a dedicated parser (DOC, ODT, RTF,
 * and DOCX as a fallback).
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser} with a {@link ToXMLContentHandler} to produce an
 * XHTML representation, then walks the DOM:
 *
 * <ul>
 *   <li>{@code <p>}, {@code <h1>} to {@code <h6>} and {@code <li>} → paragraph nodes
 *   <li>{@code <table>} → table node; {@code <td>}/{@code <th>} children are walked again, so
 *       nested tables stay nested
 *   <li>container elements ({@code <body>}, {@code <div>}, lists, …) are descended into
 *   <li>any other element → unsupported node
 * </ul>
 */
@Service
@Order(100)
@Slf4j
public class TikaXhtmlDocumentParser implements DocumentParser {

  private static final Set<String> SUPPORTED_MIME_PREFIXES =
      Set.of(
          "application/msword",
          "application/vnd.openxmlformats-officedocument.wordprocessingml",
          "application/vnd.oasis.opendocument.text",
          "application/rtf",
          "text/rtf");

  private static final Set<String> PARAGRAPH_TAGS =
      Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6", "li");

  private static final Set<String> CONTAINER_TAGS =
      Set.of("html", "body", "div", "section", "article", "ul", "ol", "blockquote");

  private static final Set<String> ROW_GROUP_TAGS = Set.of("thead", "tbody", "tfoot");

  @Override
  public List<ContentNode> parse(InputStream inputStream, String mimeType) {
    try {
      byte[] xhtmlBytes = toXhtml(inputStream, mimeType);
      return parseXhtml(xhtmlBytes);
    } catch (Exception e) {
      log.error("TikaXhtmlDocumentParser failed for mimeType={}: {}", mimeType, e.getMessage());
      throw new DocumentReadException("Failed to parse document: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    if (mimeType == null) {
      return false;
    }
    String lower = mimeType.toLowerCase(Locale.ROOT);
    return SUPPORTED_MIME_PREFIXES.stream().anyMatch(lower::startsWith);
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream inputStream, String mimeType) throws Exception {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    if (mimeType != null) {
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
    }
    tikaParser.parse(inputStream, handler, metadata);
    return out.toByteArray();
  }

  List<ContentNode> parseXhtml(byte[] xhtmlBytes)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtmlBytes));
    dom.getDocumentElement().normalize();

    List<ContentNode> nodes = new ArrayList<>();
    walkBody(dom.getDocumentElement(), nodes);
    return nodes;
  }

  private void walkBody(Element root, List<ContentNode> nodes) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = tagOf(el);

      if (PARAGRAPH_TAGS.contains(tag)) {
        nodes.add(ParagraphNode.of(el.getTextContent()));
      } else if ("table".equals(tag)) {
        nodes.add(toTable(el));
      } else if (CONTAINER_TAGS.contains(tag)) {
        walkBody(el, nodes);
      } else if (!"head".equals(tag)) {
        nodes.add(new UnsupportedNode(tag));
      }
    }
  }

  private TableNode toTable(Element tableEl) {
    List<TableRowNode> rows = new ArrayList<>();
    collectRows(tableEl, rows);
    return new TableNode(rows);
  }

  private void collectRows(Element parent, List<TableRowNode> rows) {
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = tagOf(el);
      if ("tr".equals(tag)) {
        rows.add(toRow(el));
      } else if (ROW_GROUP_TAGS.contains(tag)) {
        collectRows(el, rows);
      }
    }
  }

  private TableRowNode toRow(Element rowEl) {
    List<TableCellNode> cells = new ArrayList<>();
    NodeList children = rowEl.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      String tag = tagOf((Element) child);
      if ("td".equals(tag) || "th".equals(tag)) {
        List<ContentNode> cellNodes = new ArrayList<>();
        walkCell((Element) child, cellNodes);
        cells.add(new TableCellNode(cellNodes));
      }
    }
    return new TableRowNode(cells);
  }

  private void walkCell(Element cellEl, List<ContentNode> nodes) {
    NodeList children = cellEl.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.TEXT_NODE) {
        String text = child.getTextContent();
        if (text != null && !text.isBlank()) {
          nodes.add(ParagraphNode.of(text));
        }
      } else if (child.getNodeType() == Node.ELEMENT_NODE) {
        Element el = (Element) child;
        String tag = tagOf(el);
        if (PARAGRAPH_TAGS.contains(tag)) {
          nodes.add(ParagraphNode.of(el.getTextContent()));
        } else if ("table".equals(tag)) {
          nodes.add(toTable(el));
        } else {
          walkCell(el, nodes);
        }
      }
    }
  }

  private static String tagOf(Element el) {
    String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return tag.toLowerCase(Locale.ROOT);
  }
}
