package io.forkline.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AnalysisConfigTest {

    @Test
    void shouldUseDefaults() {
        var config = new AnalysisConfig();

        assertThat(config.getMaxDepth()).isEqualTo(AnalysisConfig.DEFAULT_MAX_DEPTH);
        assertThat(config.isIncludeMarkersInNonReplicableSet()).isFalse();
    }

    @Test
    void shouldApplyBuilderValues() {
        var config =
                AnalysisConfig.builder()
                        .maxDepth(64)
                        .includeMarkersInNonReplicableSet(true)
                        .build();

        assertThat(config.getMaxDepth()).isEqualTo(64);
        assertThat(config.isIncludeMarkersInNonReplicableSet()).isTrue();
    }

    @Test
    void shouldRejectNonPositiveMaxDepth() {
        assertThatThrownBy(() -> AnalysisConfig.builder().maxDepth(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxDepth must be positive");
    }
}
