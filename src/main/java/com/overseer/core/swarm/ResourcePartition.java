package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;

/**
 * Resource-ownership checks for sibling tasks of a phase. Two paths denote the same resource
 * only if they are equal after normalisation: separators unified, {@code .} and {@code ..}
 * segments collapsed, trailing slashes dropped. Same-named files in different directories
 * are different resources.
 */
public final class ResourcePartition {

    private static final Logger log = LoggerFactory.getLogger(ResourcePartition.class);

    private ResourcePartition() {}

    /**
     * @throws PlanningException naming the first two tasks found claiming the same resource
     */
    public static void requireDisjoint(List<AgentTask> tasks) {
        var owners = new HashMap<String, String>();
        for (AgentTask task : tasks) {
            for (String resource : task.resources()) {
                String owner = owners.putIfAbsent(normalizePath(resource), task.id());
                if (owner != null && !owner.equals(task.id())) {
                    log.error("Planning error: tasks {} and {} both claim {}", owner, task.id(), resource);
                    throw new PlanningException("Tasks " + owner + " and " + task.id()
                            + " both claim resource " + resource);
                }
            }
        }
    }

    public static boolean isDisjoint(List<AgentTask> tasks) {
        for (int i = 0; i < tasks.size(); i++) {
            for (int j = i + 1; j < tasks.size(); j++) {
                if (overlaps(tasks.get(i), tasks.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    public static boolean overlaps(AgentTask a, AgentTask b) {
        for (String left : a.resources()) {
            for (String right : b.resources()) {
                if (resourcesMatch(left, right)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean resourcesMatch(String first, String second) {
        return normalizePath(first).equals(normalizePath(second));
    }

    static String normalizePath(String path) {
        String normalized = Path.of(path.strip().replace('\\', '/')).normalize().toString().replace('\\', '/');
        return normalized.isEmpty() ? "." : normalized;
    }

    /**
     * Parent directory of a resource, or the empty string for top-level resources.
     */
    static String parentOf(String path) {
        String normalized = normalizePath(path);
        int slash = normalized.lastIndexOf('/');
        return slash <= 0 ? "" : normalized.substring(0, slash);
    }
}
