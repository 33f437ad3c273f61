package com.overseer.core.health;

import com.overseer.core.graph.OrchestrationGraph;
import com.overseer.core.hooks.HookRegistry;
import com.overseer.core.hooks.LifecyclePoint;
import com.overseer.core.swarm.AgentSwarmCoordinator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final OrchestrationGraph graph;
    private final AgentSwarmCoordinator swarm;
    private final HookRegistry hookRegistry;

    public HealthCheckService(
            @Autowired(required = false) OrchestrationGraph graph,
            @Autowired(required = false) AgentSwarmCoordinator swarm,
            @Autowired(required = false) HookRegistry hookRegistry) {
        this.graph = graph;
        this.swarm = swarm;
        this.hookRegistry = hookRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkWorkerPool());
        results.add(checkHooks());
        return results;
    }

    public boolean allUp() {
        return checkAll().stream().allMatch(s -> s.status() == HealthStatus.Status.UP);
    }

    private HealthStatus checkGraph() {
        if (graph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkWorkerPool() {
        if (swarm == null) {
            return new HealthStatus("worker-pool", HealthStatus.Status.DOWN,
                    "No swarm coordinator configured", Map.of());
        }
        var metadata = Map.of("activeWorkers", String.valueOf(swarm.activeWorkers()));
        if (!swarm.isAvailable()) {
            return new HealthStatus("worker-pool", HealthStatus.Status.DOWN,
                    "Worker pool shut down", metadata);
        }
        return new HealthStatus("worker-pool", HealthStatus.Status.UP,
                "Worker pool accepting work", metadata);
    }

    private HealthStatus checkHooks() {
        if (hookRegistry == null) {
            return new HealthStatus("hooks", HealthStatus.Status.DOWN,
                    "No hook registry configured", Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        for (LifecyclePoint point : LifecyclePoint.values()) {
            metadata.put(point.name(), String.valueOf(hookRegistry.hooksFor(point).size()));
        }
        if (hookRegistry.size() == 0) {
            return new HealthStatus("hooks", HealthStatus.Status.DEGRADED,
                    "No hooks registered", metadata);
        }
        return new HealthStatus("hooks", HealthStatus.Status.UP,
                hookRegistry.size() + " hook(s) registered", metadata);
    }
}
