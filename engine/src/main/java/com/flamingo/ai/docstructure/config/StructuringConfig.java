package com.flamingo.ai.docstructure.config;

import com.flamingo.ai.docstructure.service.grouping.KeywordTaxonomy;
import com.flamingo.ai.docstructure.service.model.AppliedSettings;
import com.flamingo.ai.docstructure.service.normalize.NormalizationSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the structuring pipeline.
 *
 * <p>The bean is mutable for property binding. A run never reads it directly: it takes an {@link
 * AppliedSettings} snapshot first, so one instance can be shared by concurrent runs.
 */
@Configuration
@ConfigurationProperties(prefix = "structuring")
@Getter
@Setter
public class StructuringConfig {

  private Normalization normalization = new Normalization();
  private NoiseRemoval noiseRemoval = new NoiseRemoval();
  private Segmentation segmentation = new Segmentation();
  private Grouping grouping = new Grouping();
  private Validation validation = new Validation();

  @Getter
  @Setter
  public static class Normalization {
    private boolean enabled = true;
    private boolean unicode = true;
    private boolean controlCharacters = true;
    private boolean whitespace = true;

    /** Fold typographic and CJK quotes to ASCII. */
    private boolean quotes = false;

    /** Fold full-width ASCII variants to half-width. */
    private boolean width = false;

    private boolean urls = false;
    private boolean punctuation = false;
  }

  @Getter
  @Setter
  public static class NoiseRemoval {
    private boolean enabled = true;

    /** Distinct pages a band text must appear on to be treated as a header or footer. */
    private int minRepetition = 3;

    /** Height of the top and bottom bands in points. */
    private double positionThreshold = 50.0;

    /** Character-set overlap from which a span counts as a variant of a detected pattern. */
    private double similarityThreshold = 0.9;
  }

  @Getter
  @Setter
  public static class Segmentation {
    private boolean enabled = true;
    private double minHeadingFontSize = 12.0;
    private double fontSizeRatioThreshold = 1.2;
  }

  @Getter
  @Setter
  public static class Grouping {
    private boolean enabled = true;

    /**
     * Additional keywords per group, merged into the built-in taxonomy. Keywords for an existing
     * group are appended. Non-ASCII group names must use bracket notation in properties ({@code
     * custom-keywords[결제][0]=invoice}), otherwise the binder strips them from the key.
     */
    private Map<String, List<String>> customKeywords = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Validation {
    private int minContentLength = 10;
    private int maxContentLength = 100_000;
  }

  /** Takes an immutable snapshot of the current values, merging custom keywords. */
  public AppliedSettings snapshot() {
    return new AppliedSettings(
        normalization.isEnabled(),
        new NormalizationSettings(
            normalization.isUnicode(),
            normalization.isControlCharacters(),
            normalization.isWhitespace(),
            normalization.isQuotes(),
            normalization.isWidth(),
            normalization.isUrls(),
            normalization.isPunctuation()),
        noiseRemoval.isEnabled(),
        noiseRemoval.getMinRepetition(),
        noiseRemoval.getPositionThreshold(),
        noiseRemoval.getSimilarityThreshold(),
        segmentation.isEnabled(),
        segmentation.getMinHeadingFontSize(),
        segmentation.getFontSizeRatioThreshold(),
        grouping.isEnabled(),
        KeywordTaxonomy.DEFAULT.merge(grouping.getCustomKeywords()),
        validation.getMinContentLength(),
        validation.getMaxContentLength());
  }
}
