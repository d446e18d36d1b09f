package com.flamingo.ai.docstructure.service.model;

import java.util.Objects;

/**
 * A single run of text extracted from a document page.
 *
 * <p>Spans are produced by an upstream extractor (native text layer or OCR). Font size and vertical
 * position are optional; when absent they are {@code null}, which makes the span invisible to the
 * header/footer bands and to font-based heading inference.
 *
 * @param page 1-based page number the span belongs to
 * @param text raw text of the span
 * @param fontSize font size in points, or {@code null} when unknown
 * @param yPosition distance from the top of the page in points, or {@code null} when unknown
 */
public record TextSpan(int page, String text, Float fontSize, Float yPosition) {

  public TextSpan {
    if (page < 1) {
      throw new IllegalArgumentException("Span page must be >= 1, got " + page);
    }
    Objects.requireNonNull(text, "text");
  }

  /** Creates a span without font or position metadata. */
  public static TextSpan of(int page, String text) {
    return new TextSpan(page, text, null, null);
  }

  public boolean hasFontSize() {
    return fontSize != null && fontSize > 0;
  }

  public boolean hasPosition() {
    return yPosition != null;
  }

  public boolean isBlank() {
    return text.isBlank();
  }

  /** Returns a copy of this span carrying different text. */
  public TextSpan withText(String newText) {
    return new TextSpan(page, newText, fontSize, yPosition);
  }
}
