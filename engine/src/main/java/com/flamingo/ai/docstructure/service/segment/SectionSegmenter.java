package com.flamingo.ai.docstructure.service.segment;

import com.flamingo.ai.docstructure.exception.SegmentationException;
import com.flamingo.ai.docstructure.service.model.Page;
import com.flamingo.ai.docstructure.service.model.PageRange;
import com.flamingo.ai.docstructure.service.model.Section;
import com.flamingo.ai.docstructure.service.model.TextSpan;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns the flat span stream of a document into a tree of {@link Section}s.
 *
 * <p>Headings are detected per span in document order, first by enumeration prefix ({@link
 * HeadingPattern}) and, failing that, by font size relative to the document average. The tree is
 * built in a single pass with an explicit stack of open headings: a new heading closes every open
 * heading of the same or a deeper level and becomes a child of whatever remains on top.
 *
 * <p>Content of a section is every non-blank, non-heading span up to the next heading. Its own page
 * range ends at the page of the span right before the next heading (the last page for the final
 * heading) and is widened to cover its subsections.
 *
 * <p>A document without any heading becomes one level-1 section named {@value
 * #FALLBACK_TITLE} spanning every page. Stateless and safe to share across threads.
 */
@Component
@Slf4j
public class SectionSegmenter {

  public static final String FALLBACK_TITLE = "Document Content";
  public static final double DEFAULT_MIN_HEADING_FONT_SIZE = 12.0;
  public static final double DEFAULT_FONT_SIZE_RATIO_THRESHOLD = 1.2;

  private static final double DEFAULT_AVERAGE_FONT_SIZE = 12.0;

  /** Segments with the default font thresholds and returns only the top-level sections. */
  public List<Section> segment(List<Page> pages) {
    return segment(pages, DEFAULT_MIN_HEADING_FONT_SIZE, DEFAULT_FONT_SIZE_RATIO_THRESHOLD);
  }

  /** Segments with the given font thresholds and returns only the top-level sections. */
  public List<Section> segment(
      List<Page> pages, double minHeadingFontSize, double fontSizeRatioThreshold) {
    return analyze(pages, minHeadingFontSize, fontSizeRatioThreshold).sections();
  }

  /**
   * Segments the document and reports how its headings were found.
   *
   * @param pages contiguous pages in document order
   * @param minHeadingFontSize smallest font size a font-inferred heading may have
   * @param fontSizeRatioThreshold minimum ratio to the average font size for a font-inferred
   *     heading
   * @return section tree and detection figures
   * @throws SegmentationException if the input violates the page contract or building fails
   */
  public SegmentationResult analyze(
      List<Page> pages, double minHeadingFontSize, double fontSizeRatioThreshold) {
    try {
      checkPageContract(pages);

      List<TextSpan> spans = pages.stream().flatMap(p -> p.spans().stream()).toList();
      if (spans.isEmpty()) {
        log.warn("No text spans found for segmentation");
        return new SegmentationResult(List.of(), 0, 0, 0, DEFAULT_AVERAGE_FONT_SIZE);
      }

      double averageFontSize = averageFontSize(spans);
      log.debug("Average font size: {}", String.format("%.2f", averageFontSize));

      List<Heading> headings =
          identifyHeadings(spans, averageFontSize, minHeadingFontSize, fontSizeRatioThreshold);
      int fontHeadings = (int) headings.stream().filter(Heading::fromFontSize).count();
      log.info("Identified {} headings ({} by font size)", headings.size(), fontHeadings);

      int firstPage = pages.get(0).number();
      int lastPage = pages.get(pages.size() - 1).number();

      if (headings.isEmpty()) {
        List<Section> fallback = fallbackSection(spans, firstPage, lastPage);
        return new SegmentationResult(fallback, 0, 0, 0, averageFontSize);
      }

      int unassigned = countNonBlank(spans.subList(0, headings.get(0).index()));
      if (unassigned > 0) {
        log.warn("{} spans precede the first heading and belong to no section", unassigned);
      }

      List<Section> sections = buildHierarchy(headings, spans, lastPage);
      log.info("Built {} top-level sections", sections.size());
      return new SegmentationResult(
          sections, headings.size() - fontHeadings, fontHeadings, unassigned, averageFontSize);
    } catch (RuntimeException e) {
      log.error("Section segmentation failed: {}", e.getMessage());
      throw new SegmentationException("Failed to segment sections: " + e.getMessage(), e);
    }
  }

  // ---- heading detection ----

  private double averageFontSize(List<TextSpan> spans) {
    return spans.stream()
        .filter(TextSpan::hasFontSize)
        .mapToDouble(TextSpan::fontSize)
        .average()
        .orElse(DEFAULT_AVERAGE_FONT_SIZE);
  }

  private List<Heading> identifyHeadings(
      List<TextSpan> spans,
      double averageFontSize,
      double minHeadingFontSize,
      double fontSizeRatioThreshold) {
    List<Heading> headings = new ArrayList<>();
    for (int i = 0; i < spans.size(); i++) {
      TextSpan span = spans.get(i);
      String text = span.text().strip();
      if (text.isEmpty()) {
        continue;
      }

      Optional<HeadingPattern.Match> match = HeadingPattern.detect(text);
      if (match.isPresent()) {
        headings.add(
            new Heading(i, span.page(), match.get().title(), match.get().level(), false));
        continue;
      }

      if (span.hasFontSize()
          && span.fontSize() >= minHeadingFontSize
          && span.fontSize() >= averageFontSize * fontSizeRatioThreshold) {
        int level = inferLevelFromFontSize(span.fontSize(), averageFontSize);
        headings.add(new Heading(i, span.page(), text, level, true));
      }
    }
    return headings;
  }

  /** Maps the ratio of a heading's font size to the document average onto a heading level. */
  static int inferLevelFromFontSize(double fontSize, double averageFontSize) {
    double ratio = fontSize / averageFontSize;
    if (ratio >= 1.8) {
      return 1;
    } else if (ratio >= 1.5) {
      return 2;
    } else if (ratio >= 1.2) {
      return 3;
    }
    return 4;
  }

  // ---- tree construction ----

  private List<Section> buildHierarchy(List<Heading> headings, List<TextSpan> spans, int lastPage) {
    List<Node> roots = new ArrayList<>();
    Deque<Node> stack = new ArrayDeque<>();

    for (int i = 0; i < headings.size(); i++) {
      Heading heading = headings.get(i);
      boolean last = i + 1 == headings.size();
      int endIdx = last ? spans.size() : headings.get(i + 1).index();

      String content =
          spans.subList(heading.index() + 1, endIdx).stream()
              .map(TextSpan::text)
              .filter(t -> !t.isBlank())
              .collect(Collectors.joining("\n"));
      int endPage = last ? lastPage : spans.get(endIdx - 1).page();

      Node node = new Node(heading.title(), heading.level(), content, heading.page(), endPage);

      // Close open headings that cannot be an ancestor
      while (!stack.isEmpty() && stack.peek().level >= heading.level()) {
        stack.pop();
      }
      if (stack.isEmpty()) {
        roots.add(node);
      } else {
        stack.peek().children.add(node);
      }
      stack.push(node);
    }

    return roots.stream().map(Node::toSection).toList();
  }

  private List<Section> fallbackSection(List<TextSpan> spans, int firstPage, int lastPage) {
    String content =
        spans.stream()
            .map(TextSpan::text)
            .filter(t -> !t.isBlank())
            .collect(Collectors.joining("\n"))
            .strip();
    if (content.isEmpty()) {
      return List.of();
    }
    log.info("No headings detected, using a single '{}' section", FALLBACK_TITLE);
    return List.of(
        new Section(FALLBACK_TITLE, 1, content, new PageRange(firstPage, lastPage), List.of()));
  }

  private int countNonBlank(List<TextSpan> spans) {
    return (int) spans.stream().filter(s -> !s.isBlank()).count();
  }

  private void checkPageContract(List<Page> pages) {
    for (int i = 0; i < pages.size(); i++) {
      Page page = pages.get(i);
      if (page.number() != i + 1) {
        throw new IllegalArgumentException(
            "Pages must be numbered contiguously from 1; found page "
                + page.number()
                + " at position "
                + (i + 1));
      }
      for (TextSpan span : page.spans()) {
        if (span.page() != page.number()) {
          throw new IllegalArgumentException(
              "Span on page " + span.page() + " listed under page " + page.number());
        }
      }
    }
  }

  // ---- inner types ----

  /**
   * A detected heading.
   *
   * @param index position of the heading span in the flattened span stream
   * @param page page the heading span is on
   * @param title heading text
   * @param level heading depth
   * @param fromFontSize {@code true} when inferred from font size rather than numbering
   */
  private record Heading(int index, int page, String title, int level, boolean fromFontSize) {}

  /** Mutable build-time node, frozen into an immutable {@link Section} once the pass ends. */
  private static final class Node {

    private final String title;
    private final int level;
    private final String content;
    private final int startPage;
    private final int endPage;
    private final List<Node> children = new ArrayList<>();

    Node(String title, int level, String content, int startPage, int endPage) {
      this.title = title;
      this.level = level;
      this.content = content;
      this.startPage = startPage;
      this.endPage = endPage;
    }

    Section toSection() {
      List<Section> subsections = children.stream().map(Node::toSection).toList();
      PageRange range = new PageRange(startPage, endPage);
      for (Section child : subsections) {
        range = range.extendTo(child.pageRange().end());
      }
      return new Section(title, level, content, range, subsections);
    }
  }
}
