package com.flamingo.ai.docstructure.service.model;

/**
 * Inclusive range of 1-based source pages covered by a section.
 *
 * @param start first page
 * @param end last page, never before {@code start}
 */
public record PageRange(int start, int end) {

  public PageRange {
    if (start < 1 || end < start) {
      throw new IllegalArgumentException("Invalid page range [" + start + ", " + end + "]");
    }
  }

  public boolean contains(PageRange other) {
    return start <= other.start && other.end <= end;
  }

  public PageRange extendTo(int page) {
    return page > end ? new PageRange(start, page) : this;
  }
}
