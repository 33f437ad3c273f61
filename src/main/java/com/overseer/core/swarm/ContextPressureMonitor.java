package com.overseer.core.swarm;

import com.overseer.core.config.OverseerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks cumulative coordination load for one workflow: waves and fix rounds run, workers
 * spawned and worker log volume. Crossing any threshold switches to conservation mode,
 * which stays on for the rest of the workflow.
 */
public class ContextPressureMonitor {

    private static final Logger log = LoggerFactory.getLogger(ContextPressureMonitor.class);

    private final int maxIterations;
    private final int maxSpawnedWorkers;
    private final long maxLogChars;
    private final int summaryLimit;
    private final int conservationSummaryLimit;

    private int iterations;
    private int spawnedWorkers;
    private long logChars;
    private String conservationReason;

    public ContextPressureMonitor(OverseerProperties.Swarm swarm) {
        this(swarm.getConservation().getMaxIterations(), swarm.getConservation().getMaxSpawnedWorkers(),
                swarm.getConservation().getMaxLogChars(), swarm.getSummaryLimit(), swarm.getConservationSummaryLimit());
    }

    public ContextPressureMonitor(int maxIterations, int maxSpawnedWorkers, long maxLogChars,
                                  int summaryLimit, int conservationSummaryLimit) {
        this.maxIterations = maxIterations;
        this.maxSpawnedWorkers = maxSpawnedWorkers;
        this.maxLogChars = maxLogChars;
        this.summaryLimit = summaryLimit;
        this.conservationSummaryLimit = conservationSummaryLimit;
    }

    public synchronized void recordIteration() {
        iterations++;
    }

    public synchronized void recordSpawn() {
        spawnedWorkers++;
    }

    public synchronized void recordLog(long chars) {
        logChars += Math.max(0, chars);
    }

    public synchronized boolean conservationMode() {
        return conservationReason != null;
    }

    public synchronized String conservationReason() {
        return conservationReason;
    }

    /**
     * Re-evaluates the thresholds.
     *
     * @return true only on the call that switched conservation mode on
     */
    public synchronized boolean checkThresholds() {
        if (conservationReason != null) {
            return false;
        }
        if (iterations >= maxIterations) {
            conservationReason = "iteration count " + iterations + " reached " + maxIterations;
        } else if (spawnedWorkers >= maxSpawnedWorkers) {
            conservationReason = "spawned workers " + spawnedWorkers + " reached " + maxSpawnedWorkers;
        } else if (logChars >= maxLogChars) {
            conservationReason = "log volume " + logChars + " chars reached " + maxLogChars;
        }
        if (conservationReason != null) {
            log.warn("Entering conservation mode: {}", conservationReason);
            return true;
        }
        return false;
    }

    /**
     * Truncates a worker summary to the size allowed in the current mode.
     */
    public synchronized String compress(String summary) {
        if (summary == null) {
            return "";
        }
        int limit = conservationReason != null ? conservationSummaryLimit : summaryLimit;
        if (summary.length() <= limit) {
            return summary;
        }
        if (limit <= 3) {
            return summary.substring(0, limit);
        }
        return summary.substring(0, limit - 3) + "...";
    }

    public synchronized int iterations() {
        return iterations;
    }

    public synchronized int spawnedWorkers() {
        return spawnedWorkers;
    }

    public synchronized long logChars() {
        return logChars;
    }
}
