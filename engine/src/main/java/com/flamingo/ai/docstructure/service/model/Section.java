package com.flamingo.ai.docstructure.service.model;

import java.util.List;

/**
 * A node in the heading tree produced by segmentation.
 *
 * <p>A section exclusively owns its subsections. The tree is built once and never changes
 * afterwards; grouping and downstream consumers only read it. Equality is structural, so code that
 * needs to tell two identical sections apart (for example multi-label grouping) compares
 * references.
 *
 * @param title heading text without its enumeration prefix
 * @param level heading depth, 1 for top level
 * @param content body text between this heading and the next one
 * @param pageRange source pages covered by this section and its subsections
 * @param subsections nested sections, each with a strictly greater level
 */
public record Section(
    String title, int level, String content, PageRange pageRange, List<Section> subsections) {

  public Section {
    if (level < 1) {
      throw new IllegalArgumentException("Section level must be >= 1, got " + level);
    }
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    subsections = subsections == null ? List.of() : List.copyOf(subsections);
  }

  public boolean hasSubsections() {
    return !subsections.isEmpty();
  }
}
