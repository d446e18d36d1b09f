package com.flamingo.ai.docstructure.service.structuring;

import com.flamingo.ai.docstructure.service.grouping.FunctionalGrouper;
import com.flamingo.ai.docstructure.service.model.FunctionalGroup;
import com.flamingo.ai.docstructure.service.model.Section;
import com.flamingo.ai.docstructure.service.model.StructuringWarning;
import com.flamingo.ai.docstructure.service.model.StructuringWarning.Kind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Inspects a grouping result for suspicious but non-fatal conditions.
 *
 * <p>Each section is reported at most once even when it belongs to several groups.
 */
@Component
@Slf4j
public class StructureValidator {

  /**
   * Collects warnings for the given groups.
   *
   * @param groups grouping output
   * @param minContentLength content shorter than this is reported
   * @param maxContentLength content longer than this is reported
   * @return warnings in group order
   */
  public List<StructuringWarning> validate(
      List<FunctionalGroup> groups, int minContentLength, int maxContentLength) {
    List<StructuringWarning> warnings = new ArrayList<>();
    if (groups.isEmpty()) {
      warn(warnings, Kind.NO_GROUPS, "No functional groups created");
      return warnings;
    }

    Set<Section> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (FunctionalGroup group : groups) {
      if (group.sections().isEmpty()) {
        warn(warnings, Kind.EMPTY_GROUP, "Functional group '" + group.name() + "' has no sections");
      }
      if (FunctionalGrouper.UNCLASSIFIED.equals(group.name())) {
        warn(
            warnings,
            Kind.UNCLASSIFIED_SECTION,
            group.size() + " sections matched no taxonomy keyword");
      }

      for (Section section : group.sections()) {
        if (!seen.add(section)) {
          continue;
        }
        checkSection(section, group.name(), minContentLength, maxContentLength, warnings);
      }
    }
    return warnings;
  }

  private void checkSection(
      Section section,
      String groupName,
      int minContentLength,
      int maxContentLength,
      List<StructuringWarning> warnings) {
    if (section.title().isBlank()) {
      warn(warnings, Kind.EMPTY_TITLE, "Section in group '" + groupName + "' has empty title");
    }
    int length = section.content().length();
    if (length > maxContentLength) {
      warn(
          warnings,
          Kind.LONG_CONTENT,
          "Section '" + section.title() + "' has very long content (" + length + " chars)");
    } else if (length < minContentLength) {
      warn(
          warnings,
          Kind.SHORT_CONTENT,
          "Section '" + section.title() + "' has very short content (" + length + " chars)");
    }
  }

  private void warn(List<StructuringWarning> warnings, Kind kind, String message) {
    log.warn(message);
    warnings.add(new StructuringWarning(kind, message));
  }
}
