package com.flamingo.ai.docstructure.service.model;

/**
 * Timing and volume figures for one pipeline stage.
 *
 * @param stage the stage
 * @param durationNanos wall-clock time spent in the stage
 * @param itemsIn units consumed (spans for text stages, sections for grouping)
 * @param itemsOut units produced
 * @param skipped {@code true} when the stage was disabled by configuration
 */
public record StageStatistics(
    Stage stage, long durationNanos, int itemsIn, int itemsOut, boolean skipped) {

  public static StageStatistics skipped(Stage stage, int items) {
    return new StageStatistics(stage, 0L, items, items, true);
  }

  public double durationMillis() {
    return durationNanos / 1_000_000.0;
  }
}
