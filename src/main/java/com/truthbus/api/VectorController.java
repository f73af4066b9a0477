package com.truthbus.api;

import com.truthbus.contract.ClaimIdentity;
import com.truthbus.engine.EpistemicEngine;
import com.truthbus.state.EpistemicState;
import com.truthbus.store.TruthVectorSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * GET /v1/vectors/{subject}/{metric}/{timeBucket}
 * GET /v1/vectors?state=ANOMALOUS
 */
@RestController
@RequestMapping("/v1/vectors")
public class VectorController {

    private final EpistemicEngine engine;

    public VectorController(EpistemicEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/{subject}/{metric}/{timeBucket}")
    public ResponseEntity<TruthVectorSnapshot> getVector(@PathVariable String subject,
                                                         @PathVariable String metric,
                                                         @PathVariable String timeBucket) {
        return engine.getVector(new ClaimIdentity(subject, metric, timeBucket))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<TruthVectorSnapshot> list(@RequestParam(required = false) EpistemicState state,
                                          @RequestParam(defaultValue = "100") int limit) {
        return engine.vectors(Optional.ofNullable(state), Math.min(limit, 1000));
    }
}
