package com.truthbus.state;

/**
 * Confidence as a function of the current evidence and state.
 *
 * Starting from the baseline: agreement among two or more sources adds the
 * corroboration bonus, disagreement subtracts a penalty proportional to the
 * contradiction score, low independence subtracts the shared-upstream penalty,
 * and reaching ARCHETYPAL adds the archetypal bonus. The result is clamped to [0,1].
 */
public class ConfidencePolicy {

    private final ConfidenceProperties properties;
    private final EpistemicStateMachine stateMachine;

    public ConfidencePolicy(ConfidenceProperties properties, EpistemicStateMachine stateMachine) {
        this.properties = properties;
        this.stateMachine = stateMachine;
    }

    public double confidence(EpistemicState state, Evidence evidence) {
        double confidence = properties.baseline();

        if (evidence.sourceCount() >= 2) {
            if (stateMachine.agrees(evidence.contradictionScore())) {
                confidence += properties.corroborationBonus();
            } else {
                confidence -= properties.contradictionPenalty() * evidence.contradictionScore();
            }
            if (evidence.independenceScore() <= properties.lowIndependenceThreshold()) {
                confidence -= properties.sharedUpstreamPenalty();
            }
        }

        if (state == EpistemicState.ARCHETYPAL) {
            confidence += properties.archetypalBonus();
        }

        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
