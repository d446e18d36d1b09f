package com.flamingo.ai.docstructure.service.structuring;

import com.flamingo.ai.docstructure.config.StructuringConfig;
import com.flamingo.ai.docstructure.exception.InvalidContentException;
import com.flamingo.ai.docstructure.exception.StructuringException;
import com.flamingo.ai.docstructure.service.grouping.FunctionalGrouper;
import com.flamingo.ai.docstructure.service.model.AppliedSettings;
import com.flamingo.ai.docstructure.service.model.FunctionalGroup;
import com.flamingo.ai.docstructure.service.model.Page;
import com.flamingo.ai.docstructure.service.model.PreprocessResult;
import com.flamingo.ai.docstructure.service.model.Section;
import com.flamingo.ai.docstructure.service.model.Stage;
import com.flamingo.ai.docstructure.service.model.StageStatistics;
import com.flamingo.ai.docstructure.service.model.StructuringDiagnostics;
import com.flamingo.ai.docstructure.service.model.StructuringWarning;
import com.flamingo.ai.docstructure.service.model.StructuringWarning.Kind;
import com.flamingo.ai.docstructure.service.model.TextSpan;
import com.flamingo.ai.docstructure.service.noise.HeaderFooterRemover;
import com.flamingo.ai.docstructure.service.noise.NoiseRemovalResult;
import com.flamingo.ai.docstructure.service.normalize.NormalizationSettings;
import com.flamingo.ai.docstructure.service.normalize.TextNormalizer;
import com.flamingo.ai.docstructure.service.segment.SectionSegmenter;
import com.flamingo.ai.docstructure.service.segment.SectionTrees;
import com.flamingo.ai.docstructure.service.segment.SegmentationResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link DocumentStructuringService}: normalize, remove headers/footers, segment, group.
 *
 * <p>Stages run strictly in sequence and each returns a new value. A stage failure aborts the run
 * and surfaces as a {@link StructuringException} naming the stage; conditions that merely look
 * wrong (short sections, unclassified sections, font-inferred headings) become warnings in the
 * result's diagnostics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStructuringServiceImpl implements DocumentStructuringService {

  /** Group holding every top-level section when functional grouping is disabled. */
  public static final String ALL_SECTIONS_GROUP = "all";

  /** Stage tag value on successful runs, so every outcome shares one tag-key set. */
  private static final String NO_STAGE = "none";

  private final TextNormalizer textNormalizer;
  private final HeaderFooterRemover headerFooterRemover;
  private final SectionSegmenter sectionSegmenter;
  private final FunctionalGrouper functionalGrouper;
  private final StructureValidator structureValidator;
  private final StructuringConfig structuringConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "structuring.process", description = "Time to structure a document")
  public PreprocessResult process(List<Page> pages) {
    return process(pages, structuringConfig);
  }

  @Override
  @Timed(value = "structuring.process", description = "Time to structure a document")
  public PreprocessResult process(List<Page> pages, StructuringConfig config) {
    Stage stage = Stage.VALIDATION;
    try {
      log.info("Starting structuring pipeline");
      List<StructuringWarning> warnings = new ArrayList<>();
      validateInput(pages, warnings);

      AppliedSettings settings = config.snapshot();
      List<StageStatistics> statistics = new ArrayList<>();

      // --- 1. Normalize ---
      stage = Stage.NORMALIZATION;
      List<Page> working = pages;
      if (settings.normalizationEnabled()) {
        long start = System.nanoTime();
        working = normalizeAll(working, settings.normalization());
        statistics.add(finish(stage, start, countSpans(pages), countSpans(working)));
      } else {
        statistics.add(StageStatistics.skipped(stage, countSpans(working)));
      }

      // --- 2. Remove headers and footers ---
      stage = Stage.NOISE_REMOVAL;
      Set<String> headerPatterns = Set.of();
      Set<String> footerPatterns = Set.of();
      if (settings.noiseRemovalEnabled()) {
        long start = System.nanoTime();
        NoiseRemovalResult noise =
            headerFooterRemover.remove(
                working,
                settings.minRepetition(),
                settings.positionThreshold(),
                settings.similarityThreshold());
        headerPatterns = noise.headerPatterns();
        footerPatterns = noise.footerPatterns();
        statistics.add(finish(stage, start, countSpans(working), countSpans(noise.pages())));
        working = noise.pages();
      } else {
        statistics.add(StageStatistics.skipped(stage, countSpans(working)));
      }

      // --- 3. Segment ---
      stage = Stage.SEGMENTATION;
      List<Section> sections = List.of();
      if (settings.segmentationEnabled()) {
        long start = System.nanoTime();
        SegmentationResult segmentation =
            sectionSegmenter.analyze(
                working, settings.minHeadingFontSize(), settings.fontSizeRatioThreshold());
        sections = segmentation.sections();
        statistics.add(
            finish(stage, start, countSpans(working), SectionTrees.countSections(sections)));
        addSegmentationWarnings(segmentation, warnings);
        log.info("Identified {} top-level sections", sections.size());
      } else {
        statistics.add(StageStatistics.skipped(stage, 0));
      }

      // --- 4. Group ---
      stage = Stage.GROUPING;
      List<FunctionalGroup> groups;
      int sectionCount = SectionTrees.countSections(sections);
      if (settings.groupingEnabled() && !sections.isEmpty()) {
        long start = System.nanoTime();
        groups = functionalGrouper.group(sections, settings.taxonomy());
        statistics.add(finish(stage, start, sectionCount, groups.size()));
      } else {
        groups =
            sections.isEmpty()
                ? List.of()
                : List.of(new FunctionalGroup(ALL_SECTIONS_GROUP, sections, Set.of()));
        statistics.add(StageStatistics.skipped(stage, sectionCount));
      }

      // --- 5. Validate ---
      stage = Stage.VALIDATION;
      warnings.addAll(
          structureValidator.validate(
              groups, settings.minContentLength(), settings.maxContentLength()));
      warnings.forEach(
          w -> meterRegistry.counter("structuring.warnings", "kind", w.kind().name()).increment());

      StructuringDiagnostics diagnostics =
          new StructuringDiagnostics(warnings, statistics, settings);
      logStatistics(groups, diagnostics);
      meterRegistry
          .counter("structuring.documents", "outcome", "success", "stage", NO_STAGE)
          .increment();

      return new PreprocessResult(groups, headerPatterns, footerPatterns, diagnostics);
    } catch (StructuringException e) {
      meterRegistry
          .counter("structuring.documents", "outcome", "failure", "stage", e.getStage().tag())
          .increment();
      throw e;
    } catch (RuntimeException e) {
      log.error("Structuring failed during {}: {}", stage.tag(), e.getMessage());
      meterRegistry
          .counter("structuring.documents", "outcome", "failure", "stage", stage.tag())
          .increment();
      throw new StructuringException(
          stage, "Failed to structure document during " + stage.tag() + ": " + e.getMessage(), e);
    }
  }

  private void validateInput(List<Page> pages, List<StructuringWarning> warnings) {
    if (pages == null || pages.isEmpty()) {
      throw new InvalidContentException("Document has no pages");
    }
    int spanCount = countSpans(pages);
    if (spanCount == 0) {
      throw new InvalidContentException("Document has no text spans on any of its pages");
    }
    boolean hasText =
        pages.stream().flatMap(p -> p.spans().stream()).anyMatch(s -> !s.isBlank());
    if (!hasText) {
      String message = "All " + spanCount + " spans are blank";
      log.warn(message);
      warnings.add(new StructuringWarning(Kind.BLANK_INPUT, message));
    }
  }

  private List<Page> normalizeAll(List<Page> pages, NormalizationSettings settings) {
    List<Page> normalized = new ArrayList<>(pages.size());
    for (Page page : pages) {
      List<TextSpan> spans = new ArrayList<>(page.spans().size());
      for (TextSpan span : page.spans()) {
        spans.add(span.withText(textNormalizer.normalize(span.text(), settings)));
      }
      normalized.add(page.withSpans(spans));
    }
    return normalized;
  }

  private void addSegmentationWarnings(
      SegmentationResult segmentation, List<StructuringWarning> warnings) {
    if (segmentation.fontHeadings() > 0) {
      warnings.add(
          new StructuringWarning(
              Kind.FONT_SIZE_HEADING,
              segmentation.fontHeadings()
                  + " headings inferred from font size (average "
                  + String.format("%.2f", segmentation.averageFontSize())
                  + ")"));
    }
    if (segmentation.unassignedSpans() > 0) {
      warnings.add(
          new StructuringWarning(
              Kind.UNASSIGNED_PREAMBLE,
              segmentation.unassignedSpans() + " spans precede the first heading"));
    }
  }

  private StageStatistics finish(Stage stage, long startNanos, int itemsIn, int itemsOut) {
    long elapsed = System.nanoTime() - startNanos;
    meterRegistry
        .timer("structuring.stage.duration", "stage", stage.tag())
        .record(elapsed, TimeUnit.NANOSECONDS);
    log.info(
        "{} completed in {} ms ({} -> {})",
        stage.tag(),
        String.format("%.2f", elapsed / 1_000_000.0),
        itemsIn,
        itemsOut);
    return new StageStatistics(stage, elapsed, itemsIn, itemsOut, false);
  }

  private void logStatistics(List<FunctionalGroup> groups, StructuringDiagnostics diagnostics) {
    log.info("=== Structuring Statistics ===");
    for (StageStatistics s : diagnostics.stageStatistics()) {
      log.info(
          "{}: {}",
          s.stage().tag(),
          s.skipped() ? "skipped" : String.format("%.2f ms", s.durationMillis()));
    }
    log.info("Functional groups: {}", groups.size());
    for (FunctionalGroup group : groups) {
      log.info("  - {}: {} sections", group.name(), group.size());
    }
    log.info("Warnings: {}", diagnostics.warnings().size());
  }

  private static int countSpans(List<Page> pages) {
    return pages.stream().mapToInt(p -> p.spans().size()).sum();
  }
}
