package com.flamingo.ai.docstructure.service.noise;

import com.flamingo.ai.docstructure.exception.NoiseRemovalException;
import com.flamingo.ai.docstructure.service.model.Page;
import com.flamingo.ai.docstructure.service.model.TextSpan;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Detects running headers and footers across pages and strips them.
 *
 * <p>For every page two bands are inspected: the top band ({@code y <= positionThreshold}) and the
 * bottom band ({@code y >= maxY - positionThreshold}, where {@code maxY} is the largest position
 * seen on that page). A trimmed text found in the same band on at least {@code minRepetition}
 * distinct pages becomes a pattern. Band texts shaped like a bare page number are patterns no
 * matter how often they occur.
 *
 * <p>Removal is not limited to the bands: any span whose trimmed text equals a pattern, or whose
 * character set overlaps a pattern's by at least {@code similarityThreshold} (Jaccard over
 * lowercased code points), is dropped. The overlap test ignores character order and multiplicity,
 * so short strings over-match ("33" is similar to "3"); callers relying on exact behaviour should
 * keep that in mind.
 *
 * <p>Spans without a position never enter a band. Stateless and safe to share across threads.
 */
@Component
@Slf4j
public class HeaderFooterRemover {

  public static final int DEFAULT_MIN_REPETITION = 3;
  public static final double DEFAULT_POSITION_THRESHOLD = 50.0;
  public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.9;

  private static final List<Pattern> PAGE_NUMBER_PATTERNS =
      List.of(
          Pattern.compile("^\\d+$"), // 7
          Pattern.compile("^page\\s+\\d+$", Pattern.CASE_INSENSITIVE), // Page 7
          Pattern.compile("^\\d+\\s*/\\s*\\d+$"), // 7 / 20
          Pattern.compile("^-\\s*\\d+\\s*-$"), // - 7 -
          Pattern.compile("^\\d+\\s+페이지$"), // 7 페이지
          Pattern.compile("^p\\.\\s*\\d+$", Pattern.CASE_INSENSITIVE)); // p. 7

  /** Runs detection and removal with the default thresholds. */
  public NoiseRemovalResult remove(List<Page> pages) {
    return remove(
        pages, DEFAULT_MIN_REPETITION, DEFAULT_POSITION_THRESHOLD, DEFAULT_SIMILARITY_THRESHOLD);
  }

  /**
   * Detects header and footer patterns and removes matching spans from every page.
   *
   * @param pages pages in document order
   * @param minRepetition distinct pages a band text must appear on to count as a pattern
   * @param positionThreshold band height in points, measured from the top and from the page's
   *     lowest observed span
   * @param similarityThreshold minimum character-set overlap for a near-duplicate to be removed
   * @return cleaned pages plus the detected patterns
   * @throws NoiseRemovalException if detection fails unexpectedly
   */
  public NoiseRemovalResult remove(
      List<Page> pages, int minRepetition, double positionThreshold, double similarityThreshold) {
    try {
      if (pages.size() < minRepetition) {
        log.debug(
            "Only {} pages (< minRepetition {}), skipping header/footer detection",
            pages.size(),
            minRepetition);
        return NoiseRemovalResult.unchanged(pages);
      }

      List<List<String>> topTexts = new ArrayList<>(pages.size());
      List<List<String>> bottomTexts = new ArrayList<>(pages.size());
      for (Page page : pages) {
        topTexts.add(topBandTexts(page, positionThreshold));
        bottomTexts.add(bottomBandTexts(page, positionThreshold));
      }

      Set<String> headerPatterns = findRepeatedPatterns(topTexts, minRepetition);
      Set<String> footerPatterns = findRepeatedPatterns(bottomTexts, minRepetition);
      log.debug("Detected header patterns: {}", headerPatterns);
      log.debug("Detected footer patterns: {}", footerPatterns);

      Set<String> allPatterns = new LinkedHashSet<>(headerPatterns);
      allPatterns.addAll(footerPatterns);

      List<Page> cleaned = new ArrayList<>(pages.size());
      int removed = 0;
      for (Page page : pages) {
        Page cleanedPage = removePatterns(page, allPatterns, similarityThreshold);
        removed += page.spans().size() - cleanedPage.spans().size();
        cleaned.add(cleanedPage);
      }

      log.info(
          "Detected {} header and {} footer patterns, removed {} spans",
          headerPatterns.size(),
          footerPatterns.size(),
          removed);
      return new NoiseRemovalResult(cleaned, headerPatterns, footerPatterns, removed);
    } catch (RuntimeException e) {
      log.error("Header/footer removal failed: {}", e.getMessage());
      throw new NoiseRemovalException("Failed to remove headers/footers: " + e.getMessage(), e);
    }
  }

  /**
   * Character-set Jaccard similarity test used for near-duplicate removal.
   *
   * @return {@code true} when both texts are non-empty and their lowercased character sets overlap
   *     by at least {@code threshold}
   */
  public static boolean isSimilar(String text1, String text2, double threshold) {
    if (text1 == null || text2 == null || text1.isEmpty() || text2.isEmpty()) {
      return false;
    }
    Set<Integer> set1 = characterSet(text1);
    Set<Integer> set2 = characterSet(text2);

    Set<Integer> union = new HashSet<>(set1);
    union.addAll(set2);
    Set<Integer> intersection = new HashSet<>(set1);
    intersection.retainAll(set2);

    double similarity = union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    return similarity >= threshold;
  }

  /** Returns {@code true} if {@code text} has one of the fixed page-number shapes. */
  public static boolean isPageNumber(String text) {
    String trimmed = text.strip();
    return PAGE_NUMBER_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).matches());
  }

  // ---- band extraction ----

  private List<String> topBandTexts(Page page, double positionThreshold) {
    List<String> texts = new ArrayList<>();
    for (TextSpan span : page.spans()) {
      if (span.hasPosition() && span.yPosition() <= positionThreshold) {
        texts.add(span.text().strip());
      }
    }
    return texts;
  }

  private List<String> bottomBandTexts(Page page, double positionThreshold) {
    double maxY = 0.0;
    for (TextSpan span : page.spans()) {
      if (span.hasPosition()) {
        maxY = Math.max(maxY, span.yPosition());
      }
    }
    double bottomThreshold = maxY - positionThreshold;

    List<String> texts = new ArrayList<>();
    for (TextSpan span : page.spans()) {
      if (span.hasPosition() && span.yPosition() >= bottomThreshold) {
        texts.add(span.text().strip());
      }
    }
    return texts;
  }

  // ---- pattern detection ----

  private Set<String> findRepeatedPatterns(List<List<String>> pageTexts, int minRepetition) {
    // Each text counts once per page
    Map<String, Integer> pageCounts = new HashMap<>();
    List<String> firstSeenOrder = new ArrayList<>();
    for (List<String> texts : pageTexts) {
      for (String text : new LinkedHashSet<>(texts)) {
        if (text.isEmpty()) {
          continue;
        }
        if (pageCounts.merge(text, 1, Integer::sum) == 1) {
          firstSeenOrder.add(text);
        }
      }
    }

    Set<String> patterns = new LinkedHashSet<>();
    for (String text : firstSeenOrder) {
      if (pageCounts.get(text) >= minRepetition || isPageNumber(text)) {
        patterns.add(text);
      }
    }
    return patterns;
  }

  // ---- removal ----

  private Page removePatterns(Page page, Set<String> patterns, double similarityThreshold) {
    if (patterns.isEmpty()) {
      return page;
    }
    List<TextSpan> kept = new ArrayList<>(page.spans().size());
    for (TextSpan span : page.spans()) {
      if (!isNoise(span.text().strip(), patterns, similarityThreshold)) {
        kept.add(span);
      }
    }
    return page.withSpans(kept);
  }

  private boolean isNoise(String text, Set<String> patterns, double similarityThreshold) {
    if (patterns.contains(text)) {
      return true;
    }
    for (String pattern : patterns) {
      if (isSimilar(text, pattern, similarityThreshold)) {
        return true;
      }
    }
    return false;
  }

  private static Set<Integer> characterSet(String text) {
    Set<Integer> chars = new HashSet<>();
    text.toLowerCase(Locale.ROOT).codePoints().forEach(chars::add);
    return chars;
  }
}
