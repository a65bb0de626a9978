package com.infragraph.expander.graph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.exception.GraphLoadException;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.Edge;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import com.infragraph.expander.graph.model.ResolvedModuleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a JSON snapshot of an already built configuration graph.
 *
 * <pre>
 * {"vertices": [{"blockType": "MODULE", "path": "main.tf", "name": "s3_module",
 *                "config": {...}, "attributes": {...},
 *                "sourceModuleObject": {"path": ..., "name": ..., "nestedModule": ..., "foreachIndex": ...},
 *                "sourceModule": [0], "forEachIndex": null}],
 *  "edges": [{"origin": 0, "dest": 1, "label": "bucket"}]}
 * </pre>
 *
 * Vertices are registered in the membership index in file order.
 */
public class GraphSnapshotLoader {
    private static final Logger log = LoggerFactory.getLogger(GraphSnapshotLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> TREE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public GraphSnapshotLoader() {
        this(new ObjectMapper());
    }

    public GraphSnapshotLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GraphStore load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            GraphStore graph = load(mapper.readTree(in), path.toString());
            log.info("Loaded graph snapshot {}: {} vertices, {} edges", path, graph.size(), graph.getEdges().size());
            return graph;
        } catch (JsonProcessingException e) {
            throw new GraphLoadException("Malformed graph snapshot " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new GraphLoadException("Failed to read graph snapshot " + path, e);
        }
    }

    public GraphStore loadJson(String json) {
        try {
            return load(mapper.readTree(json), "<inline>");
        } catch (JsonProcessingException e) {
            throw new GraphLoadException("Malformed graph snapshot: " + e.getOriginalMessage(), e);
        }
    }

    private GraphStore load(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new GraphLoadException("Graph snapshot " + source + " must be a JSON object");
        }
        GraphStore graph = new GraphStore();
        JsonNode vertices = root.path("vertices");
        if (!vertices.isArray()) {
            throw new GraphLoadException("Graph snapshot " + source + " has no 'vertices' array");
        }
        int index = 0;
        for (JsonNode vertex : vertices) {
            graph.addVertex(readBlock(vertex, index++, source));
        }
        for (JsonNode edge : root.path("edges")) {
            int origin = edge.path("origin").asInt(-1);
            int dest = edge.path("dest").asInt(-1);
            if (origin < 0 || dest < 0 || origin >= graph.size() || dest >= graph.size()) {
                throw new GraphLoadException("Edge " + edge + " in " + source + " points outside the vertex list");
            }
            graph.addEdge(new Edge(origin, dest, edge.path("label").asText("")));
        }
        return graph;
    }

    private Block readBlock(JsonNode node, int index, String source) {
        String type = node.path("blockType").asText("");
        String name = node.path("name").asText("");
        if (type.isBlank() || name.isBlank()) {
            throw new GraphLoadException("Vertex " + index + " in " + source + " needs 'blockType' and 'name'");
        }
        BlockType blockType;
        try {
            blockType = BlockType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new GraphLoadException("Vertex " + index + " in " + source + " has unknown blockType '" + type + "'", e);
        }

        Map<String, Object> config = toTree(node.get("config"));
        Map<String, Object> attributes = toTree(node.get("attributes"));
        Set<Integer> sourceModule = new LinkedHashSet<>();
        for (JsonNode idx : node.path("sourceModule")) {
            sourceModule.add(idx.asInt());
        }

        Block block = Block.builder()
                .blockType(blockType)
                .path(node.path("path").asText(""))
                .name(name)
                .config(config)
                .attributes(attributes)
                .sourceModuleObject(readKey(node.get("sourceModuleObject")))
                .sourceModule(sourceModule)
                .forEachIndex(toValue(node.get("forEachIndex")))
                .build();
        convertResolvedEntries(block);
        return block;
    }

    private ModuleInstanceKey readKey(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return new ModuleInstanceKey(
                node.path("path").asText(""),
                node.path("name").asText(""),
                readKey(node.get("nestedModule")),
                toValue(node.get("foreachIndex")));
    }

    private Map<String, Object> toTree(JsonNode node) {
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(node, TREE);
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, Object.class);
    }

    private void convertResolvedEntries(Block block) {
        Map<String, Object> body = block.getConfigBody();
        if (body == null || !(body.get(ResolvedModuleReference.ENTRY_NAME) instanceof List<?> raw)) {
            return;
        }
        List<Object> converted = new ArrayList<>(raw.size());
        for (Object entry : raw) {
            if (entry instanceof Map<?, ?> map) {
                JsonNode node = mapper.valueToTree(map);
                converted.add(new ResolvedModuleReference(
                        node.path("definitionPath").asText(""),
                        readKey(node.get("sourceModule"))));
            } else {
                converted.add(entry);
            }
        }
        body.put(ResolvedModuleReference.ENTRY_NAME, converted);
    }
}
