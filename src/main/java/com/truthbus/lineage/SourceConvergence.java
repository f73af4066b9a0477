package com.truthbus.lineage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

public record SourceConvergence(
    @JsonProperty("source_a") String sourceA,
    @JsonProperty("source_b") String sourceB,
    @JsonProperty("jaccard") double jaccard,
    @JsonProperty("shared_upstreams") Set<String> sharedUpstreams
) {}
