package com.flamingo.ai.docstructure.service.segment;

import com.flamingo.ai.docstructure.service.model.Section;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Read-only traversal helpers for section trees. */
public final class SectionTrees {

  private SectionTrees() {}

  /**
   * Flattens a section forest in pre-order (each section followed by its subsections).
   *
   * <p>Returns the original section references.
   */
  public static List<Section> flatten(List<Section> sections) {
    List<Section> flat = new ArrayList<>();
    Deque<Section> stack = new ArrayDeque<>();
    for (int i = sections.size() - 1; i >= 0; i--) {
      stack.push(sections.get(i));
    }
    while (!stack.isEmpty()) {
      Section section = stack.pop();
      flat.add(section);
      List<Section> children = section.subsections();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
    return flat;
  }

  /** Finds the first section in pre-order whose title equals {@code title}, ignoring case. */
  public static Optional<Section> findByTitle(List<Section> sections, String title) {
    String wanted = title.toLowerCase(Locale.ROOT);
    return flatten(sections).stream()
        .filter(s -> s.title().toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst();
  }

  public static int countSections(List<Section> sections) {
    return flatten(sections).size();
  }

  /** Number of nesting levels in the forest; 0 for an empty forest. */
  public static int maxDepth(List<Section> sections) {
    int max = 0;
    Deque<Section> sectionStack = new ArrayDeque<>();
    Deque<Integer> depthStack = new ArrayDeque<>();
    for (Section section : sections) {
      sectionStack.push(section);
      depthStack.push(1);
    }
    while (!sectionStack.isEmpty()) {
      Section section = sectionStack.pop();
      int depth = depthStack.pop();
      max = Math.max(max, depth);
      for (Section child : section.subsections()) {
        sectionStack.push(child);
        depthStack.push(depth + 1);
      }
    }
    return max;
  }
}
