package com.truthbus.api;

import com.truthbus.contract.ObservationEnvelope;
import com.truthbus.engine.EpistemicEngine;
import com.truthbus.store.IngestResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoint for data-collection agents.
 *
 * POST /v1/observations
 */
@RestController
@RequestMapping("/v1/observations")
public class ObservationController {

    private final EpistemicEngine engine;

    public ObservationController(EpistemicEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public IngestResult ingest(@RequestBody ObservationEnvelope observation) {
        return engine.ingest(observation);
    }
}
