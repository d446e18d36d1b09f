package com.flamingo.ai.docstructure.service.segment;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docstructure.service.model.PageRange;
import com.flamingo.ai.docstructure.service.model.Section;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionTrees Tests")
class SectionTreesTest {

  private static final PageRange RANGE = new PageRange(1, 1);

  private static Section section(String title, int level, Section... children) {
    return new Section(title, level, title + " body", RANGE, List.of(children));
  }

  private final Section leaf = section("Leaf", 3);
  private final Section child = section("Child", 2, leaf);
  private final Section root = section("Root", 1, child, section("Sibling", 2));
  private final List<Section> forest = List.of(root, section("Second", 1));

  @Test
  @DisplayName("flatten should list sections in pre-order by reference")
  void flattenShouldUsePreOrder() {
    List<Section> flat = SectionTrees.flatten(forest);

    assertThat(flat)
        .extracting(Section::title)
        .containsExactly("Root", "Child", "Leaf", "Sibling", "Second");
    assertThat(flat.get(2)).isSameAs(leaf);
  }

  @Test
  @DisplayName("findByTitle should ignore case")
  void findByTitleShouldIgnoreCase() {
    assertThat(SectionTrees.findByTitle(forest, "leaf")).containsSame(leaf);
    assertThat(SectionTrees.findByTitle(forest, "missing")).isEmpty();
  }

  @Test
  @DisplayName("should count sections and measure depth")
  void shouldCountAndMeasureDepth() {
    assertThat(SectionTrees.countSections(forest)).isEqualTo(5);
    assertThat(SectionTrees.maxDepth(forest)).isEqualTo(3);
    assertThat(SectionTrees.maxDepth(List.of())).isZero();
    assertThat(SectionTrees.flatten(List.of())).isEmpty();
  }
}
