package com.flamingo.ai.docstructure.service.model;

import com.flamingo.ai.docstructure.service.grouping.KeywordTaxonomy;
import com.flamingo.ai.docstructure.service.normalize.NormalizationSettings;

/**
 * Immutable snapshot of the configuration a structuring run used.
 *
 * <p>Taken once at the start of a run so that later changes to the mutable configuration bean can
 * never leak into a run in progress.
 */
public record AppliedSettings(
    boolean normalizationEnabled,
    NormalizationSettings normalization,
    boolean noiseRemovalEnabled,
    int minRepetition,
    double positionThreshold,
    double similarityThreshold,
    boolean segmentationEnabled,
    double minHeadingFontSize,
    double fontSizeRatioThreshold,
    boolean groupingEnabled,
    KeywordTaxonomy taxonomy,
    int minContentLength,
    int maxContentLength) {}
