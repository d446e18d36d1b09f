package com.flamingo.ai.docstructure.service.normalize;

/**
 * Toggles for the individual {@link TextNormalizer} steps.
 *
 * @param unicode apply NFC canonical composition
 * @param controlCharacters strip non-printable characters except tab, newline and carriage return
 * @param whitespace collapse horizontal whitespace, trim lines and limit blank lines
 * @param quotes fold typographic and CJK quote variants to ASCII quotes
 * @param width fold full-width ASCII variants to their half-width forms
 * @param urls remove URLs
 * @param punctuation shorten runs of three or more punctuation marks to two
 */
public record NormalizationSettings(
    boolean unicode,
    boolean controlCharacters,
    boolean whitespace,
    boolean quotes,
    boolean width,
    boolean urls,
    boolean punctuation) {

  /** Composition, control stripping and whitespace cleanup; the optional folds are off. */
  public static final NormalizationSettings DEFAULTS =
      new NormalizationSettings(true, true, true, false, false, false, false);
}
