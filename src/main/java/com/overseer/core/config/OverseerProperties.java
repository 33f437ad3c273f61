package com.overseer.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the orchestration engine, bound from {@code overseer.*}.
 */
@Component
@ConfigurationProperties(prefix = "overseer")
public class OverseerProperties {

    private Swarm swarm = new Swarm();
    private Hooks hooks = new Hooks();
    private Workflow workflow = new Workflow();
    private Classifier classifier = new Classifier();
    private Risk risk = new Risk();

    public Swarm getSwarm() { return swarm; }
    public void setSwarm(Swarm swarm) { this.swarm = swarm; }
    public Hooks getHooks() { return hooks; }
    public void setHooks(Hooks hooks) { this.hooks = hooks; }
    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }
    public Risk getRisk() { return risk; }
    public void setRisk(Risk risk) { this.risk = risk; }

    public static class Swarm {
        private int maxConcurrentWorkers = 20;
        private Duration stallGracePeriod = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(250);
        private int summaryLimit = 2000;
        private int conservationSummaryLimit = 200;
        private Conservation conservation = new Conservation();

        public int getMaxConcurrentWorkers() { return maxConcurrentWorkers; }
        public void setMaxConcurrentWorkers(int maxConcurrentWorkers) { this.maxConcurrentWorkers = maxConcurrentWorkers; }
        public Duration getStallGracePeriod() { return stallGracePeriod; }
        public void setStallGracePeriod(Duration stallGracePeriod) { this.stallGracePeriod = stallGracePeriod; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public int getSummaryLimit() { return summaryLimit; }
        public void setSummaryLimit(int summaryLimit) { this.summaryLimit = summaryLimit; }
        public int getConservationSummaryLimit() { return conservationSummaryLimit; }
        public void setConservationSummaryLimit(int conservationSummaryLimit) { this.conservationSummaryLimit = conservationSummaryLimit; }
        public Conservation getConservation() { return conservation; }
        public void setConservation(Conservation conservation) { this.conservation = conservation; }
    }

    public static class Conservation {
        private int maxIterations = 40;
        private int maxSpawnedWorkers = 60;
        private long maxLogChars = 200_000;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getMaxSpawnedWorkers() { return maxSpawnedWorkers; }
        public void setMaxSpawnedWorkers(int maxSpawnedWorkers) { this.maxSpawnedWorkers = maxSpawnedWorkers; }
        public long getMaxLogChars() { return maxLogChars; }
        public void setMaxLogChars(long maxLogChars) { this.maxLogChars = maxLogChars; }
    }

    public static class Hooks {
        private Duration submitBudget = Duration.ofMillis(500);
        private Duration mutationBudget = Duration.ofMillis(100);
        private Duration stopBudget = Duration.ofMillis(5000);
        private Duration defaultTimeout = Duration.ofMillis(250);
        private int maxThreads = 8;

        public Duration getSubmitBudget() { return submitBudget; }
        public void setSubmitBudget(Duration submitBudget) { this.submitBudget = submitBudget; }
        public Duration getMutationBudget() { return mutationBudget; }
        public void setMutationBudget(Duration mutationBudget) { this.mutationBudget = mutationBudget; }
        public Duration getStopBudget() { return stopBudget; }
        public void setStopBudget(Duration stopBudget) { this.stopBudget = stopBudget; }
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public int getMaxThreads() { return maxThreads; }
        public void setMaxThreads(int maxThreads) { this.maxThreads = maxThreads; }
    }

    public static class Workflow {
        private int maxRecoveryAttempts = 2;
        private boolean graphCheckpoints = false;

        public int getMaxRecoveryAttempts() { return maxRecoveryAttempts; }
        public void setMaxRecoveryAttempts(int maxRecoveryAttempts) { this.maxRecoveryAttempts = maxRecoveryAttempts; }
        public boolean isGraphCheckpoints() { return graphCheckpoints; }
        public void setGraphCheckpoints(boolean graphCheckpoints) { this.graphCheckpoints = graphCheckpoints; }
    }

    /**
     * Thresholds, weights and optional keyword-table overrides for request classification.
     * Empty keyword maps fall back to the built-in tables.
     */
    public static class Classifier {
        private double contextCeiling = 8.0;
        private double highComplexity = 7.0;
        private double highAggregate = 6.0;
        private double lowAggregate = 2.5;
        private double lowContext = 4.0;
        private Map<String, Double> weights = new LinkedHashMap<>();
        private Map<String, Double> complexityKeywords = new LinkedHashMap<>();
        private Map<String, Double> riskKeywords = new LinkedHashMap<>();
        private Map<String, Double> urgencyKeywords = new LinkedHashMap<>();
        private Map<String, Double> securityKeywords = new LinkedHashMap<>();

        public double getContextCeiling() { return contextCeiling; }
        public void setContextCeiling(double contextCeiling) { this.contextCeiling = contextCeiling; }
        public double getHighComplexity() { return highComplexity; }
        public void setHighComplexity(double highComplexity) { this.highComplexity = highComplexity; }
        public double getHighAggregate() { return highAggregate; }
        public void setHighAggregate(double highAggregate) { this.highAggregate = highAggregate; }
        public double getLowAggregate() { return lowAggregate; }
        public void setLowAggregate(double lowAggregate) { this.lowAggregate = lowAggregate; }
        public double getLowContext() { return lowContext; }
        public void setLowContext(double lowContext) { this.lowContext = lowContext; }
        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
        public Map<String, Double> getComplexityKeywords() { return complexityKeywords; }
        public void setComplexityKeywords(Map<String, Double> complexityKeywords) { this.complexityKeywords = complexityKeywords; }
        public Map<String, Double> getRiskKeywords() { return riskKeywords; }
        public void setRiskKeywords(Map<String, Double> riskKeywords) { this.riskKeywords = riskKeywords; }
        public Map<String, Double> getUrgencyKeywords() { return urgencyKeywords; }
        public void setUrgencyKeywords(Map<String, Double> urgencyKeywords) { this.urgencyKeywords = urgencyKeywords; }
        public Map<String, Double> getSecurityKeywords() { return securityKeywords; }
        public void setSecurityKeywords(Map<String, Double> securityKeywords) { this.securityKeywords = securityKeywords; }
    }

    /**
     * Optional keyword-list overrides for the risk decision tree. Empty lists keep the defaults.
     */
    public static class Risk {
        private List<String> irreversibleKeywords = new ArrayList<>();
        private List<String> securityKeywords = new ArrayList<>();
        private List<String> userVisibleKeywords = new ArrayList<>();
        private List<String> multiModuleKeywords = new ArrayList<>();

        public List<String> getIrreversibleKeywords() { return irreversibleKeywords; }
        public void setIrreversibleKeywords(List<String> irreversibleKeywords) { this.irreversibleKeywords = irreversibleKeywords; }
        public List<String> getSecurityKeywords() { return securityKeywords; }
        public void setSecurityKeywords(List<String> securityKeywords) { this.securityKeywords = securityKeywords; }
        public List<String> getUserVisibleKeywords() { return userVisibleKeywords; }
        public void setUserVisibleKeywords(List<String> userVisibleKeywords) { this.userVisibleKeywords = userVisibleKeywords; }
        public List<String> getMultiModuleKeywords() { return multiModuleKeywords; }
        public void setMultiModuleKeywords(List<String> multiModuleKeywords) { this.multiModuleKeywords = multiModuleKeywords; }
    }
}
