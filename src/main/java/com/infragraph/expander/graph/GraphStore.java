package com.infragraph.expander.graph;

import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.Edge;
import com.infragraph.expander.graph.model.ModuleInstanceKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Vertex store of a configuration graph plus its {@link MembershipIndex}.
 *
 * Vertex indices are append-only; a slot may be overwritten in place with
 * {@link #replaceVertex(int, Block)}.
 */
public class GraphStore {

    private final List<Block> vertices = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final MembershipIndex membership = new MembershipIndex();

    /**
     * Appends a vertex and registers it under its owning module instantiation.
     */
    public int addVertex(Block block) {
        int index = append(block);
        membership.add(block.getSourceModuleObject(), block.getBlockType(), index);
        return index;
    }

    /**
     * Appends a vertex without touching the membership index.
     */
    public int append(Block block) {
        Objects.requireNonNull(block, "block");
        vertices.add(block);
        return vertices.size() - 1;
    }

    public void replaceVertex(int index, Block block) {
        Objects.requireNonNull(block, "block");
        vertices.set(index, block);
    }

    public Block getVertex(int index) {
        return vertices.get(index);
    }

    public List<Block> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public int size() {
        return vertices.size();
    }

    public void addEdge(Edge edge) {
        edges.add(Objects.requireNonNull(edge, "edge"));
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public MembershipIndex getMembership() {
        return membership;
    }

    /**
     * Indices of MODULE vertices that carry a {@code for_each} or {@code count} statement
     * and are not yet instances.
     */
    public List<Integer> findModulesWithIteration() {
        List<Integer> found = new ArrayList<>();
        for (int i = 0; i < vertices.size(); i++) {
            Block b = vertices.get(i);
            if (b.getBlockType() == BlockType.MODULE && b.hasIterationStatement() && !b.isInstance()) {
                found.add(i);
            }
        }
        return found;
    }

    /**
     * View that drops every RESOURCE vertex not listed in {@code blocksToKeep} and every
     * edge touching a dropped vertex. All other vertices are kept at their index.
     */
    public SubGraph restrictTo(Collection<Integer> blocksToKeep) {
        Set<Integer> keep = new HashSet<>(blocksToKeep);
        List<Block> slots = new ArrayList<>(vertices.size());
        for (int i = 0; i < vertices.size(); i++) {
            Block b = vertices.get(i);
            slots.add(b.getBlockType() == BlockType.RESOURCE && !keep.contains(i) ? null : b);
        }
        List<Edge> kept = new ArrayList<>();
        for (Edge e : edges) {
            if (isSlotPresent(slots, e.getOrigin()) && isSlotPresent(slots, e.getDest())) {
                kept.add(e);
            }
        }
        return new SubGraph(this, slots, kept);
    }

    private static boolean isSlotPresent(List<Block> slots, int index) {
        return index >= 0 && index < slots.size() && slots.get(index) != null;
    }

    /**
     * Checks that every vertex is listed exactly once, under its own owning key and type,
     * and that no entry lists an index outside the store.
     *
     * @return human readable problems, empty when the index is consistent
     */
    public List<String> findMembershipViolations() {
        List<String> problems = new ArrayList<>();
        Map<Integer, List<String>> seen = new HashMap<>();
        for (ModuleInstanceKey key : membership.keys()) {
            membership.get(key).forEach((type, indices) -> {
                for (Integer idx : indices) {
                    if (idx == null || idx < 0 || idx >= vertices.size()) {
                        problems.add("Entry " + key + " lists unknown vertex " + idx);
                        continue;
                    }
                    seen.computeIfAbsent(idx, i -> new ArrayList<>()).add(key + "/" + type);
                    Block b = vertices.get(idx);
                    if (!Objects.equals(b.getSourceModuleObject(), key)) {
                        problems.add("Vertex " + idx + " (" + b.getName() + ") is listed under " + key
                                + " but belongs to " + b.getSourceModuleObject());
                    }
                    if (b.getBlockType() != type) {
                        problems.add("Vertex " + idx + " (" + b.getName() + ") is listed as " + type
                                + " but is " + b.getBlockType());
                    }
                }
            });
        }
        for (int i = 0; i < vertices.size(); i++) {
            List<String> where = seen.getOrDefault(i, List.of());
            if (where.size() != 1) {
                problems.add("Vertex " + i + " (" + vertices.get(i).getName() + ") appears in "
                        + where.size() + " membership entries " + where);
            }
        }
        return problems;
    }
}
