package com.truthbus.api;

import com.truthbus.engine.EpistemicEngine;
import com.truthbus.store.TruthVectorSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/v1/consensus")
public class ConsensusController {

    private final EpistemicEngine engine;

    public ConsensusController(EpistemicEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public List<TruthVectorSnapshot> consensus(@RequestParam(defaultValue = "100") int limit) {
        return engine.consensusVectors()
            .limit(Math.max(0, Math.min(limit, 1000)))
            .collect(Collectors.toList());
    }
}
