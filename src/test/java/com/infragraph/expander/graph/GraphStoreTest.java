package com.infragraph.expander.graph;

import com.infragraph.expander.GraphFixtures;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.Edge;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.infragraph.expander.GraphFixtures.attrs;
import static com.infragraph.expander.GraphFixtures.module;
import static com.infragraph.expander.GraphFixtures.resource;
import static org.assertj.core.api.Assertions.*;

class GraphStoreTest {

    @Test
    void testAddVertexRegistersMembership() {
        GraphStore graph = GraphFixtures.s3ModuleWithForEach();
        ModuleInstanceKey s3 = graph.getVertex(0).ownModuleKey();

        assertThat(graph.getMembership().members(null, BlockType.MODULE)).containsExactly(0);
        assertThat(graph.getMembership().members(s3, BlockType.VARIABLE)).containsExactly(1);
        assertThat(graph.getMembership().members(s3, BlockType.RESOURCE)).containsExactly(2);
        assertThat(graph.findMembershipViolations()).isEmpty();
    }

    @Test
    void testRestrictToDropsOnlyUnlistedResources() {
        GraphStore graph = GraphFixtures.s3ModuleWithForEach();
        graph.addEdge(new Edge(0, 2, "bucket"));
        graph.addEdge(new Edge(0, 1, "bucket_name"));

        SubGraph view = graph.restrictTo(List.of(0));

        assertThat(view.size()).isEqualTo(3);
        assertThat(view.indices()).containsExactly(0, 1);
        assertThat(view.contains(2)).isFalse();
        assertThat(view.vertex(0)).containsSame(graph.getVertex(0));
        assertThat(view.vertex(7)).isEmpty();
        assertThat(view.getEdges()).containsExactly(new Edge(0, 1, "bucket_name"));

        assertThat(graph.restrictTo(List.of(2)).indices()).containsExactly(0, 1, 2);
    }

    @Test
    void testFindModulesWithIteration() {
        GraphStore graph = new GraphStore();
        graph.addVertex(module("main.tf", "a", null, null, attrs("count", 2)));
        graph.addVertex(module("main.tf", "b", null, null, attrs("source", "./b")));
        graph.addVertex(resource("main.tf", "aws_instance.vm", null, null, attrs("count", 2)));
        graph.addVertex(module("main.tf", "c", null, null, attrs("for_each", List.of("x"))));
        graph.getVertex(3).setForEachIndex("x");

        assertThat(graph.findModulesWithIteration()).containsExactly(0);
    }

    @Test
    void testViolationsAreReported() {
        GraphStore graph = GraphFixtures.s3ModuleWithForEach();
        ModuleInstanceKey elsewhere = new ModuleInstanceKey("x.tf", "x", null);
        graph.getVertex(2).setSourceModuleObject(elsewhere);
        graph.append(resource("main.tf", "aws_eip.ip", null, null, attrs()));
        graph.getMembership().add(null, BlockType.DATA, 42);

        List<String> violations = graph.findMembershipViolations();

        assertThat(violations).anyMatch(v -> v.contains("Vertex 2") && v.contains("belongs to " + elsewhere));
        assertThat(violations).anyMatch(v -> v.startsWith("Vertex 3") && v.contains("appears in 0"));
        assertThat(violations).anyMatch(v -> v.contains("unknown vertex 42"));
    }
}
