package com.flamingo.ai.docstructure.service.normalize;

import com.flamingo.ai.docstructure.exception.NormalizationException;
import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cleans a single text string extracted from a document.
 *
 * <p>Steps run in a fixed order: control-character stripping, NFC composition, the optional quote,
 * width, URL and punctuation folds, and finally whitespace cleanup. Stripping runs before
 * composition so that removing a format character cannot leave an uncomposed sequence behind; with
 * {@link NormalizationSettings#DEFAULTS} the result is idempotent.
 *
 * <p>Stateless and safe to share across threads.
 */
@Component
@Slf4j
public class TextNormalizer {

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
  private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");
  private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019`]");
  private static final Pattern DOUBLE_QUOTES =
      Pattern.compile("[\\u201C\\u201D\\u300C\\u300D\\u300E\\u300F]");
  private static final Pattern URL = Pattern.compile("https?://\\S+|www\\.\\S+");
  private static final Pattern EXCESSIVE_PUNCTUATION = Pattern.compile("([.,!?;:]){3,}");

  private static final char FULL_WIDTH_FIRST = '\uFF01';
  private static final char FULL_WIDTH_LAST = '\uFF5E';
  private static final int FULL_WIDTH_OFFSET = 0xFEE0;
  private static final char IDEOGRAPHIC_SPACE = '\u3000';

  /** Normalizes {@code text} with {@link NormalizationSettings#DEFAULTS}. */
  public String normalize(String text) {
    return normalize(text, NormalizationSettings.DEFAULTS);
  }

  /**
   * Normalizes {@code text} with the given step toggles.
   *
   * @param text input text, may be {@code null}
   * @param settings which steps to apply
   * @return normalized text, never {@code null}
   * @throws NormalizationException if a step fails unexpectedly
   */
  public String normalize(String text, NormalizationSettings settings) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    try {
      String result = text;
      if (settings.controlCharacters()) {
        result = removeControlCharacters(result);
      }
      if (settings.unicode()) {
        result = Normalizer.normalize(result, Normalizer.Form.NFC);
      }
      if (settings.quotes()) {
        result = normalizeQuotes(result);
      }
      if (settings.width()) {
        result = normalizeWidth(result);
      }
      if (settings.urls()) {
        result = removeUrls(result);
      }
      if (settings.punctuation()) {
        result = removeExcessivePunctuation(result);
      }
      if (settings.whitespace()) {
        result = normalizeWhitespace(result);
      }
      return result;
    } catch (RuntimeException e) {
      log.error("Text normalization failed: {}", e.getMessage());
      throw new NormalizationException("Failed to normalize text: " + e.getMessage(), e);
    }
  }

  /** Normalizes every element of {@code texts} with the default settings. */
  public List<String> normalizeBatch(List<String> texts) {
    return texts.stream().map(this::normalize).toList();
  }

  /** Removes Unicode category C code points, keeping tab, newline and carriage return. */
  String removeControlCharacters(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    text.codePoints()
        .filter(cp -> cp == '\t' || cp == '\n' || cp == '\r' || !isOtherCategory(cp))
        .forEach(sb::appendCodePoint);
    return sb.toString();
  }

  /**
   * Collapses horizontal whitespace runs, trims every line, limits blank-line runs to one empty
   * line and trims the result.
   */
  String normalizeWhitespace(String text) {
    String[] lines = text.split("\n", -1);
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        sb.append('\n');
      }
      sb.append(HORIZONTAL_WHITESPACE.matcher(lines[i]).replaceAll(" ").strip());
    }
    return EXCESSIVE_NEWLINES.matcher(sb).replaceAll("\n\n").strip();
  }

  String normalizeQuotes(String text) {
    String singles = SINGLE_QUOTES.matcher(text).replaceAll("'");
    return DOUBLE_QUOTES.matcher(singles).replaceAll("\"");
  }

  /** Folds full-width ASCII forms (U+FF01..U+FF5E) and the ideographic space to half-width. */
  String normalizeWidth(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c >= FULL_WIDTH_FIRST && c <= FULL_WIDTH_LAST) {
        sb.append((char) (c - FULL_WIDTH_OFFSET));
      } else if (c == IDEOGRAPHIC_SPACE) {
        sb.append(' ');
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  String removeUrls(String text) {
    return URL.matcher(text).replaceAll("");
  }

  String removeExcessivePunctuation(String text) {
    return EXCESSIVE_PUNCTUATION.matcher(text).replaceAll("$1$1");
  }

  private static boolean isOtherCategory(int codePoint) {
    int type = Character.getType(codePoint);
    return type == Character.CONTROL
        || type == Character.FORMAT
        || type == Character.SURROGATE
        || type == Character.PRIVATE_USE
        || type == Character.UNASSIGNED;
  }
}
