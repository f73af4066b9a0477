package com.truthbus.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.truthbus.state.EpistemicState;

public record IngestResult(
    @JsonProperty("vector_id") String vectorId,
    @JsonProperty("epistemic_state") EpistemicState epistemicState,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("outcome") Outcome outcome
) {

    public enum Outcome {
        CREATED("created"),
        MERGED("merged"),
        DUPLICATE("duplicate");

        private final String value;

        Outcome(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
