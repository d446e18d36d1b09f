package com.flamingo.ai.docstructure.service.model;

import java.util.List;

/**
 * Diagnostic side output of a structuring run, kept for audit and reproducibility.
 *
 * @param warnings non-fatal conditions in the order they were observed
 * @param stageStatistics one entry per pipeline stage, in execution order
 * @param appliedSettings the effective settings, including the merged keyword taxonomy
 */
public record StructuringDiagnostics(
    List<StructuringWarning> warnings,
    List<StageStatistics> stageStatistics,
    AppliedSettings appliedSettings) {

  public StructuringDiagnostics {
    warnings = List.copyOf(warnings);
    stageStatistics = List.copyOf(stageStatistics);
  }

  public boolean hasWarning(StructuringWarning.Kind kind) {
    return warnings.stream().anyMatch(w -> w.kind() == kind);
  }

  public long warningCount(StructuringWarning.Kind kind) {
    return warnings.stream().filter(w -> w.kind() == kind).count();
  }

  public long totalDurationNanos() {
    return stageStatistics.stream().mapToLong(StageStatistics::durationNanos).sum();
  }
}
