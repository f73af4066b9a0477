package com.truthbus.contradiction;

import com.truthbus.contract.ValueKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric claims: relative spread {@code (max - min) / max(|mean|, eps)}, scaled
 * linearly so that {@code maxRelativeSpread} and beyond score 1.0.
 * Categorical claims: fraction of values that differ from the majority value.
 */
public class SpreadContradictionDetector implements ContradictionDetector {

    private static final double EPSILON = 1e-9;

    private final double maxRelativeSpread;

    public SpreadContradictionDetector(double maxRelativeSpread) {
        this.maxRelativeSpread = maxRelativeSpread;
    }

    @Override
    public double score(ValueKind kind, List<?> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        return switch (kind) {
            case NUMERIC -> numericScore(values);
            case CATEGORICAL -> categoricalScore(values);
        };
    }

    /**
     * Works on values divided by the largest magnitude so that sums and
     * differences of values near {@code Double.MAX_VALUE} stay finite.
     */
    private double numericScore(List<?> values) {
        double scale = 0.0;
        for (Object value : values) {
            scale = Math.max(scale, Math.abs(((Number) value).doubleValue()));
        }
        if (scale == 0.0) {
            return 0.0;
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (Object value : values) {
            double v = ((Number) value).doubleValue() / scale;
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        if (max == min) {
            return 0.0;
        }

        double mean = sum / values.size();
        // eps / scale overflows to infinity only for sub-epsilon values, which count as agreement
        double relativeSpread = (max - min) / Math.max(Math.abs(mean), EPSILON / scale);
        return Math.min(1.0, relativeSpread / maxRelativeSpread);
    }

    private double categoricalScore(List<?> values) {
        Map<Object, Integer> counts = new HashMap<>();
        int majority = 0;
        for (Object value : values) {
            int count = counts.merge(value, 1, Integer::sum);
            majority = Math.max(majority, count);
        }
        return (double) (values.size() - majority) / values.size();
    }
}
