package com.infragraph.expander.graph.model;

/**
 * Kinds of configuration blocks that appear as graph vertices.
 */
public enum BlockType {
    MODULE,
    RESOURCE,
    DATA,
    VARIABLE,
    LOCALS,
    OUTPUT,
    PROVIDER,
    TERRAFORM,
    CUSTOM
}
