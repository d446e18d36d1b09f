package com.flamingo.ai.docstructure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docstructure.config.StructuringConfig;
import com.flamingo.ai.docstructure.service.grouping.KeywordTaxonomy;
import com.flamingo.ai.docstructure.service.model.Page;
import com.flamingo.ai.docstructure.service.model.PreprocessResult;
import com.flamingo.ai.docstructure.service.model.TextSpan;
import com.flamingo.ai.docstructure.service.noise.HeaderFooterRemover;
import com.flamingo.ai.docstructure.service.normalize.TextNormalizer;
import com.flamingo.ai.docstructure.service.segment.SectionSegmenter;
import com.flamingo.ai.docstructure.service.structuring.DocumentStructuringService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies that the Spring application context loads with every pipeline stage wired and the
 * configuration bound from application.yml plus test overrides.
 */
@SpringBootTest(
    properties = {
      "structuring.noise-removal.min-repetition=4",
      "structuring.grouping.custom-keywords.shipping[0]=parcel",
      "structuring.grouping.custom-keywords.shipping[1]=warehouse",
      "structuring.grouping.custom-keywords[결제][0]=invoice",
      "structuring.grouping.custom-keywords[배송][0]=택배"
    })
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private DocumentStructuringService documentStructuringService;
  @Autowired private StructuringConfig structuringConfig;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(TextNormalizer.class)).isNotNull();
    assertThat(applicationContext.getBean(HeaderFooterRemover.class)).isNotNull();
    assertThat(applicationContext.getBean(SectionSegmenter.class)).isNotNull();
    assertThat(documentStructuringService).isNotNull();
  }

  @Test
  @DisplayName("Structuring properties should bind from configuration")
  void structuringPropertiesShouldBind() {
    assertThat(structuringConfig.getNoiseRemoval().getMinRepetition()).isEqualTo(4);
    assertThat(structuringConfig.getNoiseRemoval().getSimilarityThreshold()).isEqualTo(0.9);
    assertThat(structuringConfig.getGrouping().getCustomKeywords())
        .containsEntry("shipping", List.of("parcel", "warehouse"));
  }

  @Test
  @DisplayName("Bracketed Korean group names should bind and merge into the taxonomy")
  void bracketedKoreanGroupNamesShouldBind() {
    KeywordTaxonomy taxonomy = structuringConfig.snapshot().taxonomy();

    assertThat(structuringConfig.getGrouping().getCustomKeywords())
        .containsOnlyKeys("shipping", "결제", "배송");
    assertThat(taxonomy.keywordsFor("결제")).startsWith("결제").endsWith("invoice");
    assertThat(taxonomy.keywordsFor("배송")).containsExactly("택배");
    assertThat(taxonomy.groupNames()).doesNotContain("0");
  }

  @Test
  @DisplayName("Processing with a caller-supplied config should be timed")
  void processWithConfigShouldBeTimed() {
    List<Page> pages = List.of(new Page(1, List.of(TextSpan.of(1, "1. Logistics"))));
    long before = processTimerCount();

    documentStructuringService.process(pages, new StructuringConfig());

    assertThat(processTimerCount()).isEqualTo(before + 1);
  }

  private long processTimerCount() {
    return meterRegistry.find("structuring.process").timers().stream()
        .mapToLong(Timer::count)
        .sum();
  }

  @Test
  @DisplayName("Processing through the bean should apply bound settings and record timing")
  void processShouldApplyBoundSettings() {
    List<TextSpan> spans =
        List.of(TextSpan.of(1, "1. Logistics"), TextSpan.of(1, "Each parcel is scanned"));
    List<Page> pages = List.of(new Page(1, spans));

    PreprocessResult result = documentStructuringService.process(pages);

    assertThat(result.group("shipping")).isNotNull();
    assertThat(result.diagnostics().appliedSettings().minRepetition()).isEqualTo(4);
    Timer timer = meterRegistry.find("structuring.process").timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isGreaterThanOrEqualTo(1L);
  }
}
