package com.truthbus.state;

/**
 * Aggregate inputs to a state transition, taken after a merge.
 */
public record Evidence(int sourceCount, double contradictionScore, double independenceScore) {}
