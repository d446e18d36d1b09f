package com.flamingo.ai.docstructure.service.noise;

import com.flamingo.ai.docstructure.service.model.Page;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of {@link HeaderFooterRemover}.
 *
 * @param pages cleaned pages, same numbers and order as the input
 * @param headerPatterns texts detected as running headers, in detection order
 * @param footerPatterns texts detected as running footers, in detection order
 * @param removedSpanCount number of spans dropped across all pages
 */
public record NoiseRemovalResult(
    List<Page> pages, Set<String> headerPatterns, Set<String> footerPatterns, int removedSpanCount) {

  public NoiseRemovalResult {
    pages = List.copyOf(pages);
    headerPatterns = Collections.unmodifiableSet(new LinkedHashSet<>(headerPatterns));
    footerPatterns = Collections.unmodifiableSet(new LinkedHashSet<>(footerPatterns));
  }

  /** Result for a document in which nothing was detected. */
  public static NoiseRemovalResult unchanged(List<Page> pages) {
    return new NoiseRemovalResult(pages, Set.of(), Set.of(), 0);
  }
}
