package com.infragraph.expander.graph.model;

import lombok.Value;

/**
 * Directed dependency between two vertices, addressed by vertex index.
 */
@Value
public class Edge {
    int origin;
    int dest;
    String label;
}
