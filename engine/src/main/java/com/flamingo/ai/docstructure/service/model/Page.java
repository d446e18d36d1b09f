package com.flamingo.ai.docstructure.service.model;

import java.util.List;

/**
 * One page of extracted text: an ordered, immutable list of spans.
 *
 * @param number 1-based page number
 * @param spans spans in reading order
 */
public record Page(int number, List<TextSpan> spans) {

  public Page {
    if (number < 1) {
      throw new IllegalArgumentException("Page number must be >= 1, got " + number);
    }
    spans = spans == null ? List.of() : List.copyOf(spans);
  }

  /** Returns a page with the same number and the given spans. */
  public Page withSpans(List<TextSpan> newSpans) {
    return new Page(number, newSpans);
  }
}
