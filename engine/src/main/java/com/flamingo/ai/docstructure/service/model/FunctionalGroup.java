package com.flamingo.ai.docstructure.service.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A topical bucket of sections derived from keyword matches.
 *
 * <p>Sections are held by reference; a section can belong to several groups.
 *
 * @param name group name from the taxonomy, or {@code unclassified}
 * @param sections member sections in document order
 * @param keywords taxonomy keywords that matched at least one member, in discovery order
 */
public record FunctionalGroup(String name, List<Section> sections, Set<String> keywords) {

  public FunctionalGroup {
    sections = List.copyOf(sections);
    keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
  }

  public int size() {
    return sections.size();
  }
}
