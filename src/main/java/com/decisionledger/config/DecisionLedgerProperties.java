package com.decisionledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the decision layer, bound from {@code decision-ledger.*}.
 */
@ConfigurationProperties(prefix = "decision-ledger")
public class DecisionLedgerProperties {

    private final Engine engine = new Engine();
    private final Ledger ledger = new Ledger();
    private final Audit audit = new Audit();
    private final Legal legal = new Legal();
    private final Signer signer = new Signer();

    public Engine getEngine() {
        return engine;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public Audit getAudit() {
        return audit;
    }

    public Legal getLegal() {
        return legal;
    }

    public Signer getSigner() {
        return signer;
    }

    public static class Engine {

        /** Upper bound on a single logic evaluation, counted from when a worker starts it. */
        private Duration executionTimeout = Duration.ofSeconds(2);

        /** How long a call may wait for a free worker. */
        private Duration queueTimeout = Duration.ofSeconds(10);

        /** Size of the pool running logic. */
        private int workerThreads = 16;

        /** Frozen artifacts kept in memory by the engine. */
        private long artifactCacheSize = 1000;

        private final FeatureFetch featureFetch = new FeatureFetch();

        public Duration getExecutionTimeout() {
            return executionTimeout;
        }

        public void setExecutionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
        }

        public Duration getQueueTimeout() {
            return queueTimeout;
        }

        public void setQueueTimeout(Duration queueTimeout) {
            this.queueTimeout = queueTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public long getArtifactCacheSize() {
            return artifactCacheSize;
        }

        public void setArtifactCacheSize(long artifactCacheSize) {
            this.artifactCacheSize = artifactCacheSize;
        }

        public FeatureFetch getFeatureFetch() {
            return featureFetch;
        }
    }

    public static class FeatureFetch {

        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(50);

        private double multiplier = 2.0;

        /** Bound on each individual attempt. */
        private Duration timeout = Duration.ofSeconds(1);

        /** Size of the pool running feature store calls. */
        private int threads = 8;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Ledger {

        /** Hashed into the genesis value every chain starts from. */
        private String genesisSeed = "decision-ledger";

        private int maxBatchSize = 256;

        /** How long a caller waits for the writer to acknowledge an append. */
        private Duration appendTimeout = Duration.ofSeconds(5);

        public String getGenesisSeed() {
            return genesisSeed;
        }

        public void setGenesisSeed(String genesisSeed) {
            this.genesisSeed = genesisSeed;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public Duration getAppendTimeout() {
            return appendTimeout;
        }

        public void setAppendTimeout(Duration appendTimeout) {
            this.appendTimeout = appendTimeout;
        }
    }

    public static class Audit {

        private int replayThreads = 4;

        /** Output fields inspected, in order, when classifying drift. */
        private List<String> decisionFields = new ArrayList<>(List.of(
            "approved", "allowed", "valid", "success", "status", "eligible", "decision"));

        /** Values of a decision field that count as a favourable outcome. */
        private List<String> positiveValues = new ArrayList<>(List.of(
            "approved", "allowed", "valid", "success", "eligible", "accept"));

        public int getReplayThreads() {
            return replayThreads;
        }

        public void setReplayThreads(int replayThreads) {
            this.replayThreads = replayThreads;
        }

        public List<String> getDecisionFields() {
            return decisionFields;
        }

        public void setDecisionFields(List<String> decisionFields) {
            this.decisionFields = decisionFields;
        }

        public List<String> getPositiveValues() {
            return positiveValues;
        }

        public void setPositiveValues(List<String> positiveValues) {
            this.positiveValues = positiveValues;
        }
    }

    public static class Legal {

        private List<String> trustedHosts = new ArrayList<>(List.of("finlex.fi", "eur-lex.europa.eu"));

        public List<String> getTrustedHosts() {
            return trustedHosts;
        }

        public void setTrustedHosts(List<String> trustedHosts) {
            this.trustedHosts = trustedHosts;
        }
    }

    public static class Signer {

        /** Secret the in-process signer derives per-signer keys from. */
        private String masterSecret = "change-me";

        public String getMasterSecret() {
            return masterSecret;
        }

        public void setMasterSecret(String masterSecret) {
            this.masterSecret = masterSecret;
        }
    }
}
