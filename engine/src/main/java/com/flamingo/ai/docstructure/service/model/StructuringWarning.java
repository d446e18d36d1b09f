package com.flamingo.ai.docstructure.service.model;

/**
 * A non-fatal condition observed while structuring a document.
 *
 * @param kind category of the condition
 * @param message human-readable detail
 */
public record StructuringWarning(Kind kind, String message) {

  /** Categories of non-fatal conditions. */
  public enum Kind {
    BLANK_INPUT,
    UNASSIGNED_PREAMBLE,
    FONT_SIZE_HEADING,
    NO_GROUPS,
    EMPTY_GROUP,
    EMPTY_TITLE,
    SHORT_CONTENT,
    LONG_CONTENT,
    UNCLASSIFIED_SECTION
  }
}
