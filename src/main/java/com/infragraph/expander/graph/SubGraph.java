package com.infragraph.expander.graph;

import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.Edge;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Index-stable restriction of a {@link GraphStore}.
 *
 * Slots that were filtered out are empty; present slots hold the live blocks of the
 * underlying graph, so changes made through the view are changes to the graph.
 */
public class SubGraph {

    @Getter
    private final GraphStore graph;
    private final List<Block> vertices;
    private final List<Edge> edges;

    SubGraph(GraphStore graph, List<Block> vertices, List<Edge> edges) {
        this.graph = graph;
        this.vertices = vertices;
        this.edges = List.copyOf(edges);
    }

    public Optional<Block> vertex(int index) {
        if (index < 0 || index >= vertices.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(vertices.get(index));
    }

    public boolean contains(int index) {
        return vertex(index).isPresent();
    }

    /**
     * Indices of the slots that are present, ascending.
     */
    public List<Integer> indices() {
        List<Integer> present = new ArrayList<>();
        for (int i = 0; i < vertices.size(); i++) {
            if (vertices.get(i) != null) {
                present.add(i);
            }
        }
        return present;
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int size() {
        return vertices.size();
    }
}
