package com.decisionledger.config;

import com.decisionledger.engine.InMemoryPayloadArchive;
import com.decisionledger.engine.PayloadArchive;
import com.decisionledger.integration.FeatureStore;
import com.decisionledger.integration.HmacSigner;
import com.decisionledger.integration.InMemoryFeatureStore;
import com.decisionledger.integration.LegalReferenceValidator;
import com.decisionledger.integration.Signer;
import com.decisionledger.integration.TrustedHostLegalReferenceValidator;
import com.decisionledger.ledger.InMemoryLedgerStore;
import com.decisionledger.ledger.LedgerStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.Set;

/**
 * In-process stand-ins for the clock, storage and external capabilities.
 * Each backs off when the application defines its own bean of that type, so
 * a deployment plugs in a real KMS, feature store, legal reference service or
 * durable store by declaring it.
 */
@AutoConfiguration
public class DecisionLedgerAutoConfiguration {

    /** Source of every record timestamp. */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(Signer.class)
    public Signer signer(DecisionLedgerProperties properties) {
        return new HmacSigner(properties.getSigner().getMasterSecret());
    }

    @Bean
    @ConditionalOnMissingBean(FeatureStore.class)
    public FeatureStore featureStore() {
        return new InMemoryFeatureStore();
    }

    @Bean
    @ConditionalOnMissingBean(LegalReferenceValidator.class)
    public LegalReferenceValidator legalReferenceValidator(DecisionLedgerProperties properties) {
        return new TrustedHostLegalReferenceValidator(Set.copyOf(properties.getLegal().getTrustedHosts()));
    }

    @Bean
    @ConditionalOnMissingBean(LedgerStore.class)
    public LedgerStore ledgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    @ConditionalOnMissingBean(PayloadArchive.class)
    public PayloadArchive payloadArchive() {
        return new InMemoryPayloadArchive();
    }
}
