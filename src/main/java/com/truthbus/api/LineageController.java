package com.truthbus.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthbus.engine.EpistemicEngine;
import com.truthbus.lineage.SourceConvergence;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Lineage registration and independence queries.
 *
 * PUT  /v1/lineage/{sourceId}          register upstream providers (idempotent union)
 * POST /v1/lineage/independence        score a set of sources
 * GET  /v1/lineage/convergences        sources that covertly share upstreams
 */
@RestController
@RequestMapping("/v1/lineage")
public class LineageController {

    private final EpistemicEngine engine;

    public LineageController(EpistemicEngine engine) {
        this.engine = engine;
    }

    @PutMapping("/{sourceId}")
    public Map<String, Object> recordLineage(@PathVariable String sourceId,
                                             @RequestBody LineageRequest request) {
        engine.recordLineage(sourceId, request.upstreamIds());
        return Map.of(
            "status", "recorded",
            "source_id", sourceId
        );
    }

    @PostMapping("/independence")
    public Map<String, Object> independence(@RequestBody IndependenceRequest request) {
        return Map.of("independence_score", engine.independenceScore(request.sourceIds()));
    }

    @GetMapping("/convergences")
    public List<SourceConvergence> convergences(@RequestParam(defaultValue = "0.8") double threshold) {
        return engine.hiddenConvergences(threshold);
    }

    public record LineageRequest(@JsonProperty("upstream_ids") List<String> upstreamIds) {}

    public record IndependenceRequest(@JsonProperty("source_ids") List<String> sourceIds) {}
}
