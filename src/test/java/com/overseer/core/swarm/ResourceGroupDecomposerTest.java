package com.overseer.core.swarm;

import com.overseer.core.model.AgentTask;
import com.overseer.core.model.OwnershipModel;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Request;
import com.overseer.core.model.VerificationLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGroupDecomposerTest {

    private final ResourceGroupDecomposer decomposer = new ResourceGroupDecomposer();

    private static Phase swarm(String name) {
        return new Phase(name, OwnershipModel.PARALLEL_SWARM, VerificationLevel.FULL, false);
    }

    @Test
    @DisplayName("Read-only phases get one task without resources")
    void readOnlyPhase() {
        var request = Request.of("add caching", List.of("src/cache/Cache.java"));
        List<AgentTask> tasks = decomposer.decompose(
                new Phase("analyze", OwnershipModel.SINGLE_AGENT, VerificationLevel.NONE, true), request);

        assertEquals(1, tasks.size());
        assertTrue(tasks.get(0).resources().isEmpty());
        assertEquals("analyze-1", tasks.get(0).id());
    }

    @Test
    @DisplayName("Single-agent phases own every hinted file")
    void singleAgent() {
        var request = Request.of("fix typo", List.of("README.md", "src/App.java"));
        var tasks = decomposer.decompose(
                new Phase("execute", OwnershipModel.SINGLE_AGENT, VerificationLevel.NONE, false), request);

        assertEquals(1, tasks.size());
        assertEquals(List.of("README.md", "src/App.java"), tasks.get(0).resources());
        assertTrue(tasks.get(0).critical());
    }

    @Test
    @DisplayName("Swarm phases get one disjoint task per directory; pure documentation is non-critical")
    void swarmGroups() {
        var request = Request.of("rename the client", List.of(
                "src/api/Client.java", "src/api/Server.java", "src/util/Strings.java", "docs/guide.md"));
        var tasks = decomposer.decompose(swarm("implement"), request);

        assertEquals(3, tasks.size());
        assertEquals(List.of("src/api/Client.java", "src/api/Server.java"), tasks.get(0).resources());
        assertTrue(tasks.get(0).critical());
        assertFalse(tasks.get(2).critical());
        assertTrue(ResourcePartition.isDisjoint(tasks));
    }

    @Test
    @DisplayName("Without file hints a swarm phase still gets one task")
    void noHints() {
        var tasks = decomposer.decompose(swarm("implement"), Request.of("improve logging"));
        assertEquals(1, tasks.size());
        assertTrue(tasks.get(0).resources().isEmpty());
    }

    @Test
    @DisplayName("Documentation detection")
    void documentation() {
        assertTrue(ResourceGroupDecomposer.isDocumentation("docs/setup.html"));
        assertTrue(ResourceGroupDecomposer.isDocumentation("module/docs/a.java"));
        assertTrue(ResourceGroupDecomposer.isDocumentation("CHANGELOG.MD"));
        assertFalse(ResourceGroupDecomposer.isDocumentation("src/Docs.java"));
    }

    @Test
    @DisplayName("A root file and a same-named nested file land in disjoint sibling tasks")
    void sameNamedFilesInSiblingTasks() {
        var request = Request.of("upgrade the database driver version", List.of("pom.xml", "core/pom.xml"));
        var tasks = decomposer.decompose(swarm("implement"), request);

        assertEquals(2, tasks.size());
        assertEquals(List.of("pom.xml"), tasks.get(0).resources());
        assertEquals(List.of("core/pom.xml"), tasks.get(1).resources());
        assertTrue(ResourcePartition.isDisjoint(tasks));
        assertDoesNotThrow(() -> ResourcePartition.requireDisjoint(tasks));
    }
}
