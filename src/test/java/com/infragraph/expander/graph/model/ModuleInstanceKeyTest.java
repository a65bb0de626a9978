package com.infragraph.expander.graph.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ModuleInstanceKeyTest {

    private final ModuleInstanceKey outer = new ModuleInstanceKey("main.tf", "outer", null);
    private final ModuleInstanceKey inner = new ModuleInstanceKey("outer/main.tf", "inner", outer);
    private final ModuleInstanceKey leaf = new ModuleInstanceKey("inner/main.tf", "leaf", inner, "x");

    @Test
    void testEqualKeysAreInterchangeableInMaps() {
        Map<ModuleInstanceKey, String> map = new HashMap<>();
        map.put(new ModuleInstanceKey("outer/main.tf", "inner", new ModuleInstanceKey("main.tf", "outer", null)), "v");

        assertThat(map).containsEntry(inner, "v");
        assertThat(inner).isNotEqualTo(inner.withForeachIndex(0));
    }

    @Test
    void testRebindReplacesLinkInChain() {
        ModuleInstanceKey outerInstance = outer.withForeachIndex("a");

        ModuleInstanceKey rebound = leaf.rebind(outer, outerInstance);

        assertThat(rebound.getNestedModule().getNestedModule()).isEqualTo(outerInstance);
        assertThat(rebound.getForeachIndex()).isEqualTo("x");
        assertThat(leaf.getNestedModule().getNestedModule()).isEqualTo(outer);
    }

    @Test
    void testRebindWithoutMatchReturnsSameKey() {
        ModuleInstanceKey unrelated = new ModuleInstanceKey("other.tf", "other", null);

        assertThat(leaf.rebind(unrelated, unrelated.withForeachIndex(1))).isSameAs(leaf);
        assertThat(ModuleInstanceKey.rebind(null, outer, unrelated)).isNull();
    }

    @Test
    void testRebindOfSelf() {
        ModuleInstanceKey replacement = outer.withForeachIndex(2);

        assertThat(outer.rebind(outer, replacement)).isSameAs(replacement);
    }

    @Test
    void testDepthAndAncestry() {
        assertThat(outer.depth()).isEqualTo(1);
        assertThat(leaf.depth()).isEqualTo(3);
        assertThat(leaf.isWithin(outer)).isTrue();
        assertThat(leaf.isWithin(leaf)).isTrue();
        assertThat(outer.isWithin(leaf)).isFalse();
    }

    @Test
    void testToStringShowsChain() {
        assertThat(leaf).hasToString("outer@main.tf > inner@outer/main.tf > leaf[x]@inner/main.tf");
    }

    @Test
    void testPathAndNameAreRequired() {
        assertThatThrownBy(() -> new ModuleInstanceKey(null, "m", null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ModuleInstanceKey("main.tf", null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
