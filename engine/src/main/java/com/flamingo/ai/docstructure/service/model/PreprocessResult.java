package com.flamingo.ai.docstructure.service.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of a full structuring run.
 *
 * @param groups functional groups, taxonomy order with {@code unclassified} last
 * @param removedHeaderPatterns header texts detected and stripped from every page
 * @param removedFooterPatterns footer texts detected and stripped from every page
 * @param diagnostics warnings, per-stage statistics and the settings that produced this result
 */
public record PreprocessResult(
    List<FunctionalGroup> groups,
    Set<String> removedHeaderPatterns,
    Set<String> removedFooterPatterns,
    StructuringDiagnostics diagnostics) {

  public PreprocessResult {
    groups = List.copyOf(groups);
    removedHeaderPatterns = Collections.unmodifiableSet(new LinkedHashSet<>(removedHeaderPatterns));
    removedFooterPatterns = Collections.unmodifiableSet(new LinkedHashSet<>(removedFooterPatterns));
  }

  /** Returns the group with the given name, or {@code null} if absent. */
  public FunctionalGroup group(String name) {
    return groups.stream().filter(g -> g.name().equals(name)).findFirst().orElse(null);
  }
}
