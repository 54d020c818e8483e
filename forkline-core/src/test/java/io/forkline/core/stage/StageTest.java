package io.forkline.core.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StageTest {

    @Nested
    class IdentityTest {

        @Test
        void shouldTreatStructurallyEqualStagesAsDistinct() {
            var first = StandardStage.builder("decode").build();
            var second = StandardStage.builder("decode").build();

            assertThat(first).isNotEqualTo(second);
            assertThat(first).isEqualTo(first);
        }
    }

    @Nested
    class InputsTest {

        @Test
        void shouldKeepInputsInDeclarationOrder() {
            var a = StandardStage.builder("a").build();
            var b = StandardStage.builder("b").build();

            var zip = StandardStage.builder("zip").inputs(b, a).build();

            assertThat(zip.getInputs()).containsExactly(b, a);
        }

        @Test
        void shouldAppendLateBoundInput() {
            var loop = StandardStage.builder("loop").build();
            var feedback = StandardStage.builder("feedback").inputs(loop).build();

            loop.addInput(feedback);

            assertThat(loop.getInputs()).containsExactly(feedback);
        }

        @Test
        void shouldExposeUnmodifiableInputs() {
            var stage = StandardStage.builder("s").build();

            assertThatThrownBy(() -> stage.getInputs().add(stage))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void shouldRejectNullId() {
            assertThatThrownBy(() -> StandardStage.builder(null).build())
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("Stage ID required");
        }
    }

    @Nested
    class StageTypeTest {

        @Test
        void shouldReportTypePerStageKind() {
            var source = StandardStage.builder("source").build();

            assertThat(source.getStageType()).isEqualTo(StageType.STANDARD);
            assertThat(new RoundRobinDispatchStage("dispatch", source).getStageType())
                    .isEqualTo(StageType.ROUND_ROBIN_DISPATCH);
            assertThat(new PlaceholderStage("dummy").getStageType())
                    .isEqualTo(StageType.PLACEHOLDER);
        }

        @Test
        void shouldWireDispatcherToItsInput() {
            var source = StandardStage.builder("source").build();

            var dispatch = new RoundRobinDispatchStage("dispatch", source);

            assertThat(dispatch.getInputs()).containsExactly(source);
            assertThat(dispatch).hasToString("RoundRobinDispatchStage[dispatch]");
        }
    }
}
