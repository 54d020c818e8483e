package io.forkline.core.stage;

import java.util.ArrayList;
import java.util.List;

/// A source or transform stage that may be copied once per worker.
///
/// ### Example
/// {@snippet :
/// var source = StandardStage.builder("read-shards").build();
/// var decode = StandardStage.builder("decode").inputs(source).build();
/// }
public final class StandardStage extends Stage {

    private StandardStage(Builder builder) {
        super(builder.id, builder.inputs);
    }

    @Override
    public StageType getStageType() {
        return StageType.STANDARD;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private final List<Stage> inputs = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder inputs(Stage... inputs) {
            this.inputs.addAll(List.of(inputs));
            return this;
        }

        public Builder inputs(List<Stage> inputs) {
            this.inputs.addAll(inputs);
            return this;
        }

        public StandardStage build() {
            return new StandardStage(this);
        }
    }
}
