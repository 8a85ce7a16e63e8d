package com.decisionledger.ledger;

import com.decisionledger.config.DecisionLedgerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfiguration {

    @Bean
    public ChainHasher chainHasher(DecisionLedgerProperties properties) {
        return new ChainHasher(properties.getLedger().getGenesisSeed());
    }

    /**
     * One global, totally ordered ledger per process, shared by decision and
     * governance records.
     */
    @Bean
    public TraceLedger traceLedger(LedgerStore ledgerStore, ChainHasher chainHasher,
                                   DecisionLedgerProperties properties) {
        DecisionLedgerProperties.Ledger ledger = properties.getLedger();
        return new TraceLedger(ledgerStore, chainHasher, ledger.getMaxBatchSize(), ledger.getAppendTimeout());
    }
}
