package com.flamingo.ai.researchcache.service.extraction;

import com.flamingo.ai.researchcache.domain.enums.ExtractionMethod;
import com.flamingo.ai.researchcache.exception.ContentExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link ContentExtractor} for PDF attachments using Apache PDFBox 3.x.
 *
 * <p>Text is stripped page by page and the pages are joined with a form feed, so the chunker can
 * recover page numbers. Pages without text are kept as empty pages to keep numbering stable.
 */
@Component
@Order(1)
@Slf4j
public class PdfBoxContentExtractor implements ContentExtractor {

  public static final char PAGE_SEPARATOR = '\f';

  @Override
  public boolean supports(String contentType, String filename) {
    if (contentType != null && "application/pdf".equalsIgnoreCase(contentType)) {
      return true;
    }
    return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  @Override
  public Optional<ExtractedText> extract(Path file, String contentType) {
    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      List<String> pages = new ArrayList<>(document.getNumberOfPages());
      PDFTextStripper stripper = new PDFTextStripper();
      for (int page = 1; page <= document.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(document).strip());
      }
      if (pages.stream().allMatch(String::isEmpty)) {
        log.debug("PDF {} has no extractable text", file.getFileName());
        return Optional.empty();
      }
      log.debug("Extracted {} pages from {}", pages.size(), file.getFileName());
      return Optional.of(
          new ExtractedText(
              ExtractionMethod.PDF_TEXT, String.join(String.valueOf(PAGE_SEPARATOR), pages)));
    } catch (IOException e) {
      log.error("PDFBox extraction failed for {}: {}", file.getFileName(), e.getMessage());
      throw new ContentExtractionException(
          file.getFileName().toString(), "Failed to parse PDF: " + e.getMessage(), e);
    }
  }
}
