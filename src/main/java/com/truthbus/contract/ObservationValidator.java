package com.truthbus.contract;

import org.springframework.stereotype.Component;

import java.util.Collection;

@Component
public class ObservationValidator {

    /**
     * Structural checks that do not depend on any existing truth vector.
     */
    public void validate(ObservationEnvelope observation) {
        requireNonNull(observation, "observation cannot be null");
        requireString(observation.getSourceId(), "source_id is required");

        ClaimIdentity claim = observation.getClaim();
        requireNonNull(claim, "claim is required");
        requireString(claim.subject(), "claim.subject is required");
        requireString(claim.metric(), "claim.metric is required");
        requireString(claim.timeBucket(), "claim.time_bucket is required");

        requireNonNull(observation.getTimestamp(), "timestamp is required");
        requireNonNull(observation.getValueKind(), "value_kind is required");
        requireNonNull(observation.getValue(), "value is required");

        switch (observation.getValueKind()) {
            case NUMERIC -> {
                if (!(observation.getValue() instanceof Number number)) {
                    throw new ObservationValidationException("value must be a number when value_kind=numeric");
                }
                if (!Double.isFinite(number.doubleValue())) {
                    throw new ObservationValidationException("value must be finite when value_kind=numeric");
                }
            }
            case CATEGORICAL -> requireString(observation.getValue(),
                "value must be a non-blank string when value_kind=categorical");
        }

        if (observation.getUpstreamLineage() != null) {
            validateSourceIds(observation.getUpstreamLineage(), "upstream_lineage");
        }
    }

    /**
     * A claim keeps the value kind of its first accepted observation.
     */
    public void validateKind(ObservationEnvelope observation, ValueKind declaredKind) {
        if (declaredKind != null && declaredKind != observation.getValueKind()) {
            throw new ObservationValidationException(
                "value_kind " + observation.getValueKind().getValue()
                    + " does not match declared kind " + declaredKind.getValue()
                    + " for claim " + observation.getClaim());
        }
    }

    /**
     * Numeric values are widened to {@code Double} so that 5 and 5.0 compare equal.
     */
    public Object canonicalValue(ObservationEnvelope observation) {
        return switch (observation.getValueKind()) {
            case NUMERIC -> ((Number) observation.getValue()).doubleValue();
            case CATEGORICAL -> observation.getValue();
        };
    }

    public void validateSourceIds(Collection<String> ids, String field) {
        requireNonNull(ids, field + " is required");
        for (String id : ids) {
            requireString(id, field + " must contain non-blank ids");
        }
    }

    public void validateSourceId(String sourceId) {
        requireString(sourceId, "source_id is required");
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ObservationValidationException(message);
        }
        return text;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ObservationValidationException(message);
        }
    }
}
