package com.flamingo.ai.docstructure.service.segment;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Enumeration styles recognised as section headings, tried in declaration order.
 *
 * <p>Each pattern captures the numbering in group 1 and the title in group 2. The heading level is
 * derived from the numbering: dot count + 1 for dotted decimals, hash-run length for markup, 1 for
 * everything else.
 */
public enum HeadingPattern {
  /** {@code 1. Title} */
  DECIMAL("^(\\d+)\\.\\s+(.+)$"),
  /** {@code 1.1 Title} */
  DECIMAL_TWO_LEVEL("^(\\d+\\.\\d+)\\s+(.+)$"),
  /** {@code 1.1.1 Title} */
  DECIMAL_THREE_LEVEL("^(\\d+\\.\\d+\\.\\d+)\\s+(.+)$"),
  /** {@code ## Title} */
  MARKUP("^(#{1,6})\\s+(.+)$"),
  /** {@code 가. Title} */
  KOREAN_ORDINAL("^([\\uAC00-\\uD7A3])\\.\\s+(.+)$"),
  /** {@code [1] Title} */
  BRACKETED("^\\[(\\d+)\\]\\s+(.+)$");

  private final Pattern pattern;

  HeadingPattern(String regex) {
    this.pattern = Pattern.compile(regex);
  }

  /**
   * A heading recognised from its enumeration prefix.
   *
   * @param style the matching enumeration style
   * @param numbering the captured numbering, e.g. {@code 1.2} or {@code ##}
   * @param title the heading text without numbering
   * @param level heading depth derived from the numbering
   */
  public record Match(HeadingPattern style, String numbering, String title, int level) {}

  /** Matches {@code text} against every style in order and returns the first hit. */
  public static Optional<Match> detect(String text) {
    for (HeadingPattern style : values()) {
      Matcher matcher = style.pattern.matcher(text);
      if (matcher.matches()) {
        String numbering = matcher.group(1);
        return Optional.of(
            new Match(style, numbering, matcher.group(2).strip(), levelOf(numbering)));
      }
    }
    return Optional.empty();
  }

  static int levelOf(String numbering) {
    if (numbering.contains(".")) {
      return (int) numbering.chars().filter(c -> c == '.').count() + 1;
    }
    if (numbering.contains("#")) {
      return numbering.length();
    }
    return 1;
  }
}
