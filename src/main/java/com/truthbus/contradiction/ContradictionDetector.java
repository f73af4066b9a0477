package com.truthbus.contradiction;

import com.truthbus.contract.ValueKind;

import java.util.List;

/**
 * Scores disagreement among the values currently reported for one claim.
 * Implementations must be pure and safe to call concurrently.
 */
public interface ContradictionDetector {

    /**
     * @param kind the claim's declared value kind
     * @param values one current value per reporting source
     * @return 0.0 for full agreement (or fewer than two values), up to 1.0
     */
    double score(ValueKind kind, List<?> values);
}
