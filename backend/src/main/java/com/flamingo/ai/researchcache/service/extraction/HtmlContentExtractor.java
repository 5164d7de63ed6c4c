package com.flamingo.ai.researchcache.service.extraction;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import com.flamingo.ai.researchcache.exception.ContentExtractionException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * {@link ContentExtractor} for saved web pages.
 *
 * <p>Apache Tika's {@link AutoDetectParser} normalizes the HTML to XHTML through a {@link
 * ToXMLContentHandler}; the DOM is then walked to produce markdown-style text:
 *
 * <ul>
 *   <li>{@code <h1>}–{@code <h6>} become {@code #}-prefixed heading lines, which the chunker uses
 *       as section ids
 *   <li>{@code <table>} elements become pipe tables
 *   <li>paragraph-like elements become blank-line separated paragraphs
 * </ul>
 */
@Component
@Order(2)
@Slf4j
public class HtmlContentExtractor implements ContentExtractor {

  private static final Set<String> PARAGRAPH_TAGS =
      Set.of("p", "li", "pre", "blockquote", "dd", "dt", "figcaption", "caption");

  private static final Set<String> SKIPPED_TAGS = Set.of("head", "script", "style", "title");

  @Override
  public boolean supports(String contentType, String filename) {
    String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    if (type.startsWith("text/html") || type.startsWith("application/xhtml")) {
      return true;
    }
    String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
    return name.endsWith(".html") || name.endsWith(".htm");
  }

  @Override
  public Optional<ExtractedText> extract(Path file, String contentType) {
    try (InputStream in = Files.newInputStream(file)) {
      byte[] xhtml = toXhtml(in, contentType);
      String markdown = toMarkdown(xhtml).strip();
      if (markdown.isEmpty()) {
        log.debug("HTML {} has no extractable text", file.getFileName());
        return Optional.empty();
      }
      return Optional.of(new ExtractedText(ExtractionMethod.HTML, markdown));
    } catch (Exception e) {
      log.error("HTML extraction failed for {}: {}", file.getFileName(), e.getMessage());
      throw new ContentExtractionException(
          file.getFileName().toString(), "Failed to parse HTML: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private byte[] toXhtml(InputStream in, String contentType) throws Exception {
    AutoDetectParser parser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, contentType == null ? "text/html" : contentType);
    parser.parse(in, handler, metadata);
    return out.toByteArray();
  }

  private String toMarkdown(byte[] xhtml) throws Exception {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    dom.getDocumentElement().normalize();

    StringBuilder out = new StringBuilder();
    walk(dom.getDocumentElement(), out);
    return out.toString();
  }

  private void walk(Element element, StringBuilder out) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() == Node.TEXT_NODE) {
        appendParagraph(out, child.getTextContent());
        continue;
      }
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = tagName(el);

      if (SKIPPED_TAGS.contains(tag)) {
        continue;
      }
      if (tag.matches("h[1-6]")) {
        int level = tag.charAt(1) - '0';
        String heading = collapse(el.getTextContent());
        if (!heading.isEmpty()) {
          out.append("#".repeat(level)).append(' ').append(heading).append("\n\n");
        }
      } else if ("table".equals(tag)) {
        String table = tableToMarkdown(el);
        if (!table.isEmpty()) {
          out.append(table).append('\n');
        }
      } else if (PARAGRAPH_TAGS.contains(tag)) {
        appendParagraph(out, el.getTextContent());
      } else {
        // body, div, section, article, ul, ...
        walk(el, out);
      }
    }
  }

  private void appendParagraph(StringBuilder out, String text) {
    String collapsed = collapse(text);
    if (!collapsed.isEmpty()) {
      out.append(collapsed).append("\n\n");
    }
  }

  private String tableToMarkdown(Element table) {
    StringBuilder sb = new StringBuilder();
    NodeList rows = table.getElementsByTagNameNS("*", "tr");
    boolean headerDone = false;
    for (int r = 0; r < rows.getLength(); r++) {
      NodeList cells = rows.item(r).getChildNodes();
      StringBuilder row = new StringBuilder("|");
      int cellCount = 0;
      for (int c = 0; c < cells.getLength(); c++) {
        Node cell = cells.item(c);
        if (cell.getNodeType() != Node.ELEMENT_NODE) {
          continue;
        }
        String cellTag = tagName((Element) cell);
        if ("td".equals(cellTag) || "th".equals(cellTag)) {
          row.append(' ').append(collapse(cell.getTextContent())).append(" |");
          cellCount++;
        }
      }
      if (cellCount == 0) {
        continue;
      }
      sb.append(row).append('\n');
      if (!headerDone) {
        sb.append('|').append("---|".repeat(cellCount)).append('\n');
        headerDone = true;
      }
    }
    return sb.toString();
  }

  private static String tagName(Element el) {
    String name = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
    return name.toLowerCase(Locale.ROOT);
  }

  private static String collapse(String text) {
    return text == null ? "" : text.replaceAll("\\s+", " ").strip();
  }
}
