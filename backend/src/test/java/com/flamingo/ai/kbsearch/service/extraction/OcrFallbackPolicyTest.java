package com.flamingo.ai.kbsearch.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OcrFallbackPolicyTest {

  private final OcrFallbackPolicy policy = new OcrFallbackPolicy(new IngestionConfig());

  @Test
  @DisplayName("should scale the threshold with the page count")
  void shouldScaleThreshold() {
    assertThat(policy.threshold(0)).isEqualTo(50);
    assertThat(policy.threshold(1)).isEqualTo(50);
    assertThat(policy.threshold(10)).isEqualTo(200);
  }

  @Test
  @DisplayName("should ignore whitespace when counting characters")
  void shouldIgnoreWhitespace() {
    String spaced = "a \n".repeat(49);

    assertThat(policy.isNearEmpty(spaced, 1)).isTrue();
    assertThat(policy.isNearEmpty(spaced + "bc", 1)).isFalse();
    assertThat(policy.isNearEmpty("x".repeat(150), 10)).isTrue();
  }

  @Test
  @DisplayName("should flag pages below the per-page minimum")
  void shouldFlagThinPages() {
    assertThat(policy.isPageNearEmpty("  12  ")).isTrue();
    assertThat(policy.isPageNearEmpty(null)).isTrue();
    assertThat(policy.isPageNearEmpty("Capitolato tecnico di gara")).isFalse();
  }
}
