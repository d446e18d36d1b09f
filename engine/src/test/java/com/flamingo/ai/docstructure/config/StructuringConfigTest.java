package com.flamingo.ai.docstructure.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docstructure.service.grouping.KeywordTaxonomy;
import com.flamingo.ai.docstructure.service.model.AppliedSettings;
import com.flamingo.ai.docstructure.service.normalize.NormalizationSettings;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StructuringConfig Tests")
class StructuringConfigTest {

  @Test
  @DisplayName("snapshot should carry the documented defaults")
  void snapshotShouldCarryDefaults() {
    AppliedSettings settings = new StructuringConfig().snapshot();

    assertThat(settings.normalizationEnabled()).isTrue();
    assertThat(settings.normalization()).isEqualTo(NormalizationSettings.DEFAULTS);
    assertThat(settings.minRepetition()).isEqualTo(3);
    assertThat(settings.positionThreshold()).isEqualTo(50.0);
    assertThat(settings.similarityThreshold()).isEqualTo(0.9);
    assertThat(settings.minHeadingFontSize()).isEqualTo(12.0);
    assertThat(settings.fontSizeRatioThreshold()).isEqualTo(1.2);
    assertThat(settings.taxonomy()).isSameAs(KeywordTaxonomy.DEFAULT);
    assertThat(settings.minContentLength()).isEqualTo(10);
    assertThat(settings.maxContentLength()).isEqualTo(100_000);
  }

  @Test
  @DisplayName("snapshot should merge custom keywords into the default taxonomy")
  void snapshotShouldMergeCustomKeywords() {
    StructuringConfig config = new StructuringConfig();
    config.getGrouping().setCustomKeywords(Map.of("결제", List.of("Invoice"), "배송", List.of("택배")));

    KeywordTaxonomy taxonomy = config.snapshot().taxonomy();

    assertThat(taxonomy.keywordsFor("결제")).startsWith("결제").endsWith("invoice");
    assertThat(taxonomy.keywordsFor("배송")).containsExactly("택배");
    assertThat(taxonomy.groupNames()).last().isEqualTo("배송");
    assertThat(KeywordTaxonomy.DEFAULT.contains("배송")).isFalse();
  }

  @Test
  @DisplayName("snapshot should reflect toggled normalization steps")
  void snapshotShouldReflectToggles() {
    StructuringConfig config = new StructuringConfig();
    config.getNormalization().setQuotes(true);
    config.getNormalization().setWhitespace(false);
    config.getSegmentation().setEnabled(false);

    AppliedSettings settings = config.snapshot();

    assertThat(settings.normalization().quotes()).isTrue();
    assertThat(settings.normalization().whitespace()).isFalse();
    assertThat(settings.segmentationEnabled()).isFalse();
  }
}
