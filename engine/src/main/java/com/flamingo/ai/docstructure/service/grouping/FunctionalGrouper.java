package com.flamingo.ai.docstructure.service.grouping;

import com.flamingo.ai.docstructure.exception.GroupingException;
import com.flamingo.ai.docstructure.service.model.FunctionalGroup;
import com.flamingo.ai.docstructure.service.model.Section;
import com.flamingo.ai.docstructure.service.segment.SectionTrees;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies sections into functional groups by keyword containment.
 *
 * <p>The section tree is flattened for matching only; groups hold the original section
 * references, so the hierarchy below a grouped section is preserved. Classification is
 * multi-label. Sections that hit no keyword land in a trailing {@value #UNCLASSIFIED} group, which
 * exists only when it has members.
 */
@Component
@Slf4j
public class FunctionalGrouper {

  public static final String UNCLASSIFIED = "unclassified";

  /** Groups with {@link KeywordTaxonomy#DEFAULT}. */
  public List<FunctionalGroup> group(List<Section> sections) {
    return group(sections, KeywordTaxonomy.DEFAULT);
  }

  /**
   * Groups {@code sections} using {@code taxonomy}.
   *
   * @param sections top-level sections; subsections are classified too
   * @param taxonomy group names and their keywords
   * @return named groups in taxonomy order, then {@value #UNCLASSIFIED} if needed
   * @throws GroupingException if classification fails unexpectedly
   */
  public List<FunctionalGroup> group(List<Section> sections, KeywordTaxonomy taxonomy) {
    try {
      List<Section> flat = SectionTrees.flatten(sections);
      log.info("Starting functional grouping for {} sections", flat.size());

      Map<String, List<Section>> members = new LinkedHashMap<>();
      Map<String, Set<String>> hitKeywords = new LinkedHashMap<>();
      for (String name : taxonomy.groupNames()) {
        members.put(name, new ArrayList<>());
        hitKeywords.put(name, new LinkedHashSet<>());
      }

      Set<Section> classified = Collections.newSetFromMap(new IdentityHashMap<>());
      for (Section section : flat) {
        Map<String, Set<String>> matches = match(section, taxonomy);
        matches.forEach(
            (name, kws) -> {
              members.get(name).add(section);
              hitKeywords.get(name).addAll(kws);
            });
        if (!matches.isEmpty()) {
          classified.add(section);
        }
      }

      List<FunctionalGroup> groups = new ArrayList<>();
      members.forEach(
          (name, groupSections) -> {
            if (!groupSections.isEmpty()) {
              groups.add(new FunctionalGroup(name, groupSections, hitKeywords.get(name)));
            }
          });

      List<Section> unclassified = flat.stream().filter(s -> !classified.contains(s)).toList();
      if (!unclassified.isEmpty()) {
        log.info("Found {} unclassified sections", unclassified.size());
        groups.add(new FunctionalGroup(UNCLASSIFIED, unclassified, Set.of()));
      }

      log.info("Created {} functional groups", groups.size());
      return groups;
    } catch (RuntimeException e) {
      log.error("Functional grouping failed: {}", e.getMessage());
      throw new GroupingException("Failed to group sections: " + e.getMessage(), e);
    }
  }

  /**
   * Finds every group with at least one keyword contained in the section's title or content.
   *
   * @return group name to the keywords that hit, in taxonomy order; empty when nothing matched
   */
  Map<String, Set<String>> match(Section section, KeywordTaxonomy taxonomy) {
    String text = (section.title() + " " + section.content()).toLowerCase(Locale.ROOT);
    Map<String, Set<String>> matches = new LinkedHashMap<>();
    taxonomy
        .asMap()
        .forEach(
            (name, keywords) -> {
              Set<String> hits = new LinkedHashSet<>();
              for (String keyword : keywords) {
                if (text.contains(keyword)) {
                  hits.add(keyword);
                }
              }
              if (!hits.isEmpty()) {
                matches.put(name, hits);
              }
            });
    return matches;
  }
}
