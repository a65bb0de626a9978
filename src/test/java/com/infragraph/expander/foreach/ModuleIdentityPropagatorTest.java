package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import com.infragraph.expander.graph.model.ResolvedModuleReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.infragraph.expander.GraphFixtures.attrs;
import static com.infragraph.expander.GraphFixtures.module;
import static com.infragraph.expander.GraphFixtures.resource;
import static org.assertj.core.api.Assertions.*;

class ModuleIdentityPropagatorTest {

    private GraphStore graph;
    private ModuleInstanceKey original;
    private ModuleInstanceKey nested;

    /**
     * <pre>
     * 0 module m
     * 1 resource in m
     * 2 module n in m
     * 3 resource in n
     * 4 resource at root
     * </pre>
     */
    @BeforeEach
    void setUp() {
        graph = new GraphStore();
        graph.addVertex(module("main.tf", "m", null, null, attrs("for_each", attrs("k", 1))));
        original = graph.getVertex(0).ownModuleKey();
        graph.addVertex(resource("m/main.tf", "aws_vpc.main", original, 0, attrs(
                ResolvedModuleReference.ENTRY_NAME, List.of(new ResolvedModuleReference("m/main.tf", original)))));
        graph.addVertex(module("m/main.tf", "n", original, 0, attrs()));
        nested = graph.getVertex(2).ownModuleKey();
        graph.addVertex(resource("n/main.tf", "aws_subnet.s", nested, 2, attrs(
                ResolvedModuleReference.ENTRY_NAME, List.of(new ResolvedModuleReference("n/main.tf", nested)))));
        graph.addVertex(resource("main.tf", "aws_eip.ip", null, null, attrs()));
    }

    private ModuleInstanceKey turnIntoInstance(Object key) {
        Block m = graph.getVertex(0);
        m.setForEachIndex(key);
        ModuleInstanceKey instanceKey = m.ownModuleKey();
        graph.getMembership().rekey(original, instanceKey);
        return instanceKey;
    }

    @Test
    void testDescendantsArePointedAtInstance() {
        ModuleInstanceKey instance = turnIntoInstance("k");

        int visited = new ModuleIdentityPropagator(graph).updateDescendantIdentity(instance, original);

        assertThat(visited).isEqualTo(3);
        assertThat(graph.getVertex(1).getSourceModuleObject()).isEqualTo(instance);
        assertThat(graph.getVertex(2).getSourceModuleObject()).isEqualTo(instance);

        ModuleInstanceKey nestedInInstance = graph.getVertex(2).ownModuleKey();
        assertThat(nestedInInstance).isEqualTo(new ModuleInstanceKey("m/main.tf", "n", instance));
        assertThat(graph.getVertex(3).getSourceModuleObject()).isEqualTo(nestedInInstance);
        assertThat(graph.getVertex(4).getSourceModuleObject()).isNull();
    }

    @Test
    void testNestedEntryIsRekeyed() {
        ModuleInstanceKey instance = turnIntoInstance("k");

        new ModuleIdentityPropagator(graph).updateDescendantIdentity(instance, original);

        assertThat(graph.getMembership().contains(nested)).isFalse();
        assertThat(graph.getMembership().contains(new ModuleInstanceKey("m/main.tf", "n", instance))).isTrue();
        assertThat(graph.findMembershipViolations()).isEmpty();
    }

    @Test
    void testResolvedReferencesAreRewrittenThroughNesting() {
        ModuleInstanceKey instance = turnIntoInstance("k");

        new ModuleIdentityPropagator(graph).updateDescendantIdentity(instance, original);

        assertThat(graph.getVertex(1).getResolvedModuleEntries())
                .containsExactly(new ResolvedModuleReference("m/main.tf", instance));
        assertThat(graph.getVertex(3).getResolvedModuleEntries())
                .containsExactly(new ResolvedModuleReference("n/main.tf",
                        new ModuleInstanceKey("m/main.tf", "n", instance)));
    }

    @Test
    void testUnknownStartingEntryVisitsNothing() {
        ModuleInstanceKey unrelated = new ModuleInstanceKey("x.tf", "x", null, 0);

        int visited = new ModuleIdentityPropagator(graph).updateDescendantIdentity(unrelated, original);

        assertThat(visited).isZero();
        assertThat(graph.getVertex(1).getSourceModuleObject()).isEqualTo(original);
    }

    @Test
    void testReferencesToOtherModulesAreKept() {
        ModuleInstanceKey other = new ModuleInstanceKey("o.tf", "other", null);
        Block block = resource("main.tf", "aws_eip.ip", null, null, attrs(
                ResolvedModuleReference.ENTRY_NAME, List.of(new ResolvedModuleReference("o.tf", other))));

        ModuleIdentityPropagator.rewriteResolvedReferences(block, original, original.withForeachIndex("k"));

        assertThat(block.getResolvedModuleEntries())
                .containsExactly(new ResolvedModuleReference("o.tf", other));
    }
}
