package com.truthbus.lineage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LineageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LineageConfiguration.class);

    @Bean
    public DependencyGraph dependencyGraph(LineageProperties properties) {
        AdjacencyMapDependencyGraph graph = new AdjacencyMapDependencyGraph();
        properties.sources().forEach(graph::recordLineage);
        log.info("Dependency graph preloaded with {} configured sources", properties.sources().size());
        return graph;
    }
}
