package com.truthbus.state;

/**
 * Trust level of a truth vector. ARCHETYPAL is the trusted state, but it is
 * not sticky: every merge recomputes the state from current evidence.
 */
public enum EpistemicState {
    RAW_OBSERVATION,
    CORROBORATED,
    DISPUTED,
    ANOMALOUS,
    ARCHETYPAL
}
