package com.flamingo.ai.docstructure.service.segment;

import com.flamingo.ai.docstructure.service.model.Section;
import java.util.List;

/**
 * Section tree plus the detection figures gathered while building it.
 *
 * @param sections top-level sections
 * @param patternHeadings headings recognised by their enumeration prefix
 * @param fontHeadings headings inferred from font size alone
 * @param unassignedSpans non-blank spans before the first heading, not attached to any section
 * @param averageFontSize document-wide average font size used for inference
 */
public record SegmentationResult(
    List<Section> sections,
    int patternHeadings,
    int fontHeadings,
    int unassignedSpans,
    double averageFontSize) {

  public SegmentationResult {
    sections = List.copyOf(sections);
  }

  public boolean isFallback() {
    return patternHeadings + fontHeadings == 0 && !sections.isEmpty();
  }
}
