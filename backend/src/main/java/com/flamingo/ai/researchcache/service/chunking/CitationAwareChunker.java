package com.flamingo.ai.researchcache.service.chunking;

import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.domain.enums.ChunkingMode;
import com.flamingo.ai.researchcache.domain.model.ChunkData;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentChunker} that keeps the provenance needed for citations.
 *
 * <p>Three modes:
 *
 * <ul>
 *   <li><strong>Paged</strong>: pages (form-feed separated) are laid end to end with a blank
 *       line between them and accumulated into a buffer. The buffer is flushed before a page that
 *       would push it past {@code chunkSize}, unless it is still shorter than {@code
 *       minChunkSize}, in which case it absorbs the page. A buffer that alone exceeds {@code
 *       chunkSize} is split. {@code pageNumber} is the page on which the chunk's new
 *       (non-overlap) text starts.
 *   <li><strong>Sectioned</strong>: markdown headings delimit sections; each section is split on
 *       its own and its chunks carry the heading as {@code sectionId}. Text before the first
 *       heading forms a section without id. Text without headings is chunked plain.
 *   <li><strong>Plain</strong>: character offsets only.
 * </ul>
 *
 * <p>Offsets always refer to the text the chunker was given, except in paged mode, where they
 * refer to the joined page text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CitationAwareChunker implements DocumentChunker {

  static final String PAGE_JOINER = "\n\n";

  private static final Pattern HEADING =
      Pattern.compile("^(#{1,6})[ \\t]+(.+)$", Pattern.MULTILINE);

  private final ResearchCacheProperties properties;

  @Override
  public List<ChunkData> chunk(String text, ChunkingMode mode) {
    return chunk(text, mode, defaultOptions());
  }

  @Override
  public List<ChunkData> chunk(String text, ChunkingMode mode, ChunkingOptions options) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    ChunkCollector collector = new ChunkCollector(options);
    switch (mode) {
      case PAGED -> chunkPaged(text, collector);
      case SECTIONED -> chunkSectioned(text, collector);
      case PLAIN -> splitRange(text, 0, text.length(), null, true, collector);
    }
    log.debug("Created {} {} chunks from {} chars", collector.chunks.size(), mode, text.length());
    return collector.chunks;
  }

  public ChunkingOptions defaultOptions() {
    ResearchCacheProperties.Chunking chunking = properties.getChunking();
    return new ChunkingOptions(chunking.getSize(), chunking.getOverlap(), chunking.getMinSize());
  }

  // ---- paged ----

  private void chunkPaged(String text, ChunkCollector out) {
    PageLayout layout = PageLayout.of(text);
    if (layout.pages.isEmpty()) {
      return;
    }
    String joined = layout.joined;
    ChunkingOptions options = out.options;

    int bufStart = -1;
    int bufEnd = -1;
    int contentStart = -1;
    for (PageSpan page : layout.pages) {
      if (bufStart < 0) {
        bufStart = page.start;
        contentStart = page.start;
      } else if (page.end - bufStart > options.chunkSize()
          && bufEnd - bufStart >= options.minChunkSize()) {
        out.emit(joined, bufStart, bufEnd, layout.pageAt(contentStart), null, false);
        bufStart = Math.max(bufStart + 1, bufEnd - options.chunkOverlap());
        contentStart = page.start;
      }
      bufEnd = page.end;

      while (bufEnd - bufStart > options.chunkSize()) {
        int split = SplitPointFinder.find(joined, bufStart, bufStart + options.chunkSize());
        out.emit(joined, bufStart, split, layout.pageAt(contentStart), null, false);
        bufStart = Math.max(bufStart + 1, split - options.chunkOverlap());
        contentStart = split;
      }
    }
    out.emit(joined, bufStart, bufEnd, layout.pageAt(contentStart), null, true);
  }

  // ---- sectioned ----

  private void chunkSectioned(String text, ChunkCollector out) {
    List<int[]> bounds = new ArrayList<>();
    List<String> ids = new ArrayList<>();
    Matcher matcher = HEADING.matcher(text);
    while (matcher.find()) {
      bounds.add(new int[] {matcher.start(), -1});
      ids.add(matcher.group(1) + " " + matcher.group(2).strip());
    }
    if (bounds.isEmpty()) {
      splitRange(text, 0, text.length(), null, true, out);
      return;
    }
    for (int i = 0; i < bounds.size(); i++) {
      bounds.get(i)[1] = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : text.length();
    }

    int firstHeading = bounds.get(0)[0];
    if (!text.substring(0, firstHeading).isBlank()) {
      splitRange(text, 0, firstHeading, null, false, out);
    }
    for (int i = 0; i < bounds.size(); i++) {
      boolean lastSection = i == bounds.size() - 1;
      splitRange(text, bounds.get(i)[0], bounds.get(i)[1], ids.get(i), lastSection, out);
    }
  }

  // ---- plain ----

  /**
   * Splits {@code text[from, to)} with the split-point heuristic. When {@code documentTail} is set
   * the final fragment is kept even if it is shorter than the minimum.
   */
  private void splitRange(
      String text, int from, int to, String sectionId, boolean documentTail, ChunkCollector out) {
    String range = text.substring(0, to);
    int pos = from;
    while (pos < to) {
      int end =
          pos + out.options.chunkSize() >= to
              ? to
              : SplitPointFinder.find(range, pos, pos + out.options.chunkSize());
      boolean last = end >= to;
      out.emit(text, pos, end, null, sectionId, last && documentTail);
      if (last) {
        break;
      }
      pos = Math.max(pos + 1, end - out.options.chunkOverlap());
    }
  }

  // ---- helpers ----

  /** Accumulates chunks and hands out consecutive indexes. */
  private static final class ChunkCollector {
    private final ChunkingOptions options;
    private final List<ChunkData> chunks = new ArrayList<>();

    private ChunkCollector(ChunkingOptions options) {
      this.options = options;
    }

    void emit(
        String source, int start, int end, Integer page, String sectionId, boolean keepShort) {
      String trimmed = source.substring(start, end).strip();
      if (trimmed.isEmpty()) {
        return;
      }
      if (trimmed.length() < options.minChunkSize() && !keepShort) {
        return;
      }
      chunks.add(new ChunkData(trimmed, chunks.size(), page, sectionId, start, end));
    }
  }

  private record PageSpan(int number, int start, int end) {}

  /** Non-empty pages laid out in one string, with each page's span and 1-based number. */
  private static final class PageLayout {
    private final String joined;
    private final List<PageSpan> pages;

    private PageLayout(String joined, List<PageSpan> pages) {
      this.joined = joined;
      this.pages = pages;
    }

    static PageLayout of(String text) {
      String[] raw = text.split("\f", -1);
      StringBuilder joined = new StringBuilder();
      List<PageSpan> pages = new ArrayList<>();
      for (int i = 0; i < raw.length; i++) {
        String page = raw[i].strip();
        if (page.isEmpty()) {
          continue;
        }
        if (joined.length() > 0) {
          joined.append(PAGE_JOINER);
        }
        int start = joined.length();
        joined.append(page);
        pages.add(new PageSpan(i + 1, start, joined.length()));
      }
      return new PageLayout(joined.toString(), pages);
    }

    /** Page containing {@code offset}; offsets in a separator belong to the page before it. */
    int pageAt(int offset) {
      int number = pages.get(0).number;
      for (PageSpan page : pages) {
        if (page.start > offset) {
          break;
        }
        number = page.number;
      }
      return number;
    }
  }
}
