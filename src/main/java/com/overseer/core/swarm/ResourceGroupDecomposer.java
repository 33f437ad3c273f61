package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.OwnershipModel;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Request;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Default decomposition driven by the request's file hints.
 * <p>
 * Read-only phases (plan, analyze, verify) get a single task without resources. Other
 * single-agent phases get one task owning every hint. Swarm phases get one task per parent
 * directory; a group made only of documentation is non-critical.
 */
public class ResourceGroupDecomposer implements TaskDecomposer {

    static final Set<String> READ_ONLY_PHASES = Set.of("plan", "analyze", "verify");

    private static final Set<String> DOC_EXTENSIONS = Set.of(".md", ".txt", ".rst", ".adoc");

    @Override
    public List<AgentTask> decompose(Phase phase, Request request) {
        String name = phase.name();
        if (READ_ONLY_PHASES.contains(name.toLowerCase(Locale.ROOT))) {
            return List.of(AgentTask.pending(name + "-1", name,
                    name + ": " + request.description(), List.of(), true));
        }
        if (phase.ownership() == OwnershipModel.SINGLE_AGENT || request.fileHints().isEmpty()) {
            return List.of(AgentTask.pending(name + "-1", name,
                    name + ": " + request.description(), request.fileHints(), true));
        }

        var groups = new LinkedHashMap<String, List<String>>();
        for (String hint : request.fileHints()) {
            groups.computeIfAbsent(ResourcePartition.parentOf(hint), k -> new ArrayList<>()).add(hint);
        }
        var tasks = new ArrayList<AgentTask>();
        int n = 1;
        for (var group : groups.entrySet()) {
            String scope = group.getKey().isEmpty() ? "root" : group.getKey();
            boolean critical = !group.getValue().stream().allMatch(ResourceGroupDecomposer::isDocumentation);
            tasks.add(AgentTask.pending(name + "-" + n++, name,
                    name + " " + scope + ": " + request.description(), group.getValue(), critical));
        }
        return tasks;
    }

    static boolean isDocumentation(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.startsWith("docs/") || lower.contains("/docs/")
                || DOC_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
