package com.truthbus.state;

/**
 * Pure transition function from aggregate evidence to an epistemic state.
 *
 * The state is recomputed from scratch after every merge, so a vector that
 * was ARCHETYPAL drops back as soon as a contradicting value arrives.
 */
public class EpistemicStateMachine {

    private final StateProperties properties;

    public EpistemicStateMachine(StateProperties properties) {
        this.properties = properties;
    }

    public EpistemicState transition(Evidence evidence) {
        if (evidence.sourceCount() <= 1) {
            return EpistemicState.RAW_OBSERVATION;
        }

        double c = evidence.contradictionScore();
        if (c >= properties.disputeThreshold()) {
            return EpistemicState.DISPUTED;
        }
        if (c >= properties.corroborationThreshold()) {
            return EpistemicState.ANOMALOUS;
        }

        if (evidence.sourceCount() >= properties.archetypalMinSources()
                && evidence.independenceScore() > properties.archetypalMinIndependence()) {
            return EpistemicState.ARCHETYPAL;
        }
        return EpistemicState.CORROBORATED;
    }

    /**
     * Vectors that need a human look: anything anomalous, or a strong
     * contradiction that still carries above-baseline confidence.
     */
    public boolean requiresInvestigation(EpistemicState state, double contradictionScore, double confidence) {
        return state == EpistemicState.ANOMALOUS
            || (contradictionScore > properties.disputeThreshold() && confidence > 0.5);
    }

    public boolean agrees(double contradictionScore) {
        return contradictionScore < properties.corroborationThreshold();
    }
}
