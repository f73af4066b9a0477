package com.truthbus.contradiction;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ContradictionConfiguration {

    @Bean
    public ContradictionDetector contradictionDetector(ContradictionProperties properties) {
        return new SpreadContradictionDetector(properties.maxRelativeSpread());
    }
}
