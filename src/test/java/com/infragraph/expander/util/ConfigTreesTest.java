package com.infragraph.expander.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConfigTreesTest {

    @Test
    void testDeepCopyRebuildsContainers() {
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("tags", new LinkedHashMap<>(Map.of("env", "dev")));
        original.put("zones", new ArrayList<>(List.of("a")));

        Map<String, Object> copy = ConfigTrees.deepCopy(original);

        assertThat(copy).isEqualTo(original).isNotSameAs(original);
        assertThat(copy.get("tags")).isNotSameAs(original.get("tags"));
        assertThat(copy.get("zones")).isNotSameAs(original.get("zones"));
    }

    @Test
    void testWholeStringPlaceholderKeepsType() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("count", "${count.index}");
        tree.put("object", "each.value");
        tree.put("nested", new ArrayList<>(List.of("each.key")));

        ConfigTrees.substitute(tree, Map.of(
                "count.index", 3,
                "each.key", "k",
                "each.value", Map.of("size", 2)));

        assertThat(tree)
                .containsEntry("count", 3)
                .containsEntry("object", Map.of("size", 2))
                .containsEntry("nested", List.of("k"));
    }

    @Test
    void testEmbeddedPlaceholderIsReplacedTextually() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("name", "bucket-${each.key}-${count.index}");
        tree.put("untouched", "${var.other}-${each.key}");

        ConfigTrees.substitute(tree, Map.of("each.key", "eu", "count.index", 0));

        assertThat(tree)
                .containsEntry("name", "bucket-eu-0")
                .containsEntry("untouched", "${var.other}-eu");
    }

    @Test
    void testMissingMappingPathIsLeftAlone() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("value", "each.value.missing");

        ConfigTrees.substitute(tree, Map.of("each.value", Map.of("present", 1)));

        assertThat(tree).containsEntry("value", "each.value.missing");
    }

    @Test
    void testUnwrapInterpolation() {
        assertThat(ConfigTrees.unwrapInterpolation(" ${ var.x } ")).isEqualTo("var.x");
        assertThat(ConfigTrees.unwrapInterpolation("var.x")).isEqualTo("var.x");
        assertThat(ConfigTrees.unwrapInterpolation("a-${var.x}")).isNull();
        assertThat(ConfigTrees.unwrapInterpolation("${a}${b}")).isNull();
    }

    @ParameterizedTest
    @CsvSource({
            "var.items, true",
            "${local.x}, true",
            "module.vpc.id, true",
            "prefix-${each.key}, true",
            "plain, false",
            "variable, false"
    })
    void testUnresolvedReferenceDetection(String value, boolean expected) {
        assertThat(ConfigTrees.isUnresolvedReference(value)).isEqualTo(expected);
    }

    @Test
    void testIsResolvedLooksAtEveryLeaf() {
        assertThat(ConfigTrees.isResolved(Map.of("a", List.of(1, "x")))).isTrue();
        assertThat(ConfigTrees.isResolved(Map.of("a", List.of(1, "var.y")))).isFalse();
        assertThat(ConfigTrees.isResolved(null)).isFalse();
        assertThat(ConfigTrees.isResolved(5)).isTrue();
    }
}
