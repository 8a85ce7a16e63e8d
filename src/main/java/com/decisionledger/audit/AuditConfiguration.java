package com.decisionledger.audit;

import com.decisionledger.config.DecisionLedgerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AuditConfiguration {

    /** Fans out batch replays; each replay still evaluates on the decision workers. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService auditReplayPool(DecisionLedgerProperties properties) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("audit-replay-");
        threads.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getAudit().getReplayThreads(), threads);
    }
}
