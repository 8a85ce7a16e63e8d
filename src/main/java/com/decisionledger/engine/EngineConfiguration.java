package com.decisionledger.engine;

import com.decisionledger.config.DecisionLedgerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfiguration {

    /** Runs decision logic so that each evaluation can be bounded by a timeout. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService decisionWorkers(DecisionLedgerProperties properties) {
        return fixedPool("decision-worker-", properties.getEngine().getWorkerThreads());
    }

    /** Feature store calls get their own workers so slow fetches never queue ahead of logic. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService featureFetchWorkers(DecisionLedgerProperties properties) {
        return fixedPool("feature-fetch-", properties.getEngine().getFeatureFetch().getThreads());
    }

    private static ExecutorService fixedPool(String prefix, int threads) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(threads, factory);
    }
}
