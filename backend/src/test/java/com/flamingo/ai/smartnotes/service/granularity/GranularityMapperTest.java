package com.flamingo.ai.smartnotes.service.granularity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.smartnotes.config.SmartNotesConfig;
import com.flamingo.ai.smartnotes.domain.model.SegmentationHint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("GranularityMapper")
class GranularityMapperTest {

  private GranularityMapper mapper;

  @BeforeEach
  void setUp() {
    mapper = new GranularityMapper(new SmartNotesConfig());
  }

  @Test
  @DisplayName("should use the configured range at both ends")
  void shouldUseConfiguredRange_whenAtExtremes() {
    SegmentationHint broad = mapper.map(0);
    SegmentationHint fine = mapper.map(100);

    assertThat(broad.maxTopics()).isEqualTo(2);
    assertThat(broad.minTopics()).isEqualTo(1);
    assertThat(fine.maxTopics()).isEqualTo(24);
    assertThat(fine.minTopics()).isEqualTo(12);
  }

  @Test
  @DisplayName("should never decrease the topic ceiling as granularity grows")
  void shouldBeMonotonic_whenGranularityIncreases() {
    int previous = 0;
    for (int g = 0; g <= 100; g++) {
      SegmentationHint hint = mapper.map(g);
      assertThat(hint.maxTopics()).isGreaterThanOrEqualTo(previous);
      assertThat(hint.minTopics()).isBetween(1, hint.maxTopics());
      previous = hint.maxTopics();
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {-50, -1})
  @DisplayName("should clamp values below zero")
  void shouldClamp_whenBelowZero(int granularity) {
    assertThat(mapper.map(granularity)).isEqualTo(mapper.map(0));
  }

  @ParameterizedTest
  @ValueSource(ints = {101, 1000})
  @DisplayName("should clamp values above one hundred")
  void shouldClamp_whenAboveHundred(int granularity) {
    assertThat(mapper.map(granularity).granularity()).isEqualTo(100);
  }

  @Test
  @DisplayName("should describe broad and fine resolutions differently")
  void shouldChangeGuidance_whenBandChanges() {
    assertThat(mapper.map(10).guidance()).contains("broad");
    assertThat(mapper.map(90).guidance()).contains("fine-grained");
    assertThat(mapper.map(50).guidance()).isEqualTo(mapper.map(55).guidance());
  }

  @Test
  @DisplayName("should reject an inverted topic range")
  void shouldThrow_whenRangeInverted() {
    SmartNotesConfig config = new SmartNotesConfig();
    config.getGranularity().setMinTopics(10);
    config.getGranularity().setMaxTopics(3);

    assertThatThrownBy(() -> new GranularityMapper(config))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("min-topics=10");
  }
}
