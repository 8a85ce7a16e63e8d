package com.decisionledger.registry;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RegistryConfiguration {

    @Bean
    public RegistryStore<DecisionFunctionArtifact> artifactStore() {
        return new InMemoryRegistryStore<>();
    }

    @Bean
    public RegistryStore<EffectiveVersionIndex> effectiveIndexStore() {
        return new InMemoryRegistryStore<>();
    }
}
