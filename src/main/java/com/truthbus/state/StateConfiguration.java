package com.truthbus.state;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StateConfiguration {

    @Bean
    public EpistemicStateMachine epistemicStateMachine(StateProperties properties) {
        return new EpistemicStateMachine(properties);
    }

    @Bean
    public ConfidencePolicy confidencePolicy(ConfidenceProperties properties, EpistemicStateMachine stateMachine) {
        return new ConfidencePolicy(properties, stateMachine);
    }
}
