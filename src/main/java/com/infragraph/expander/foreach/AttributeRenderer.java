package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.SubGraph;
import com.infragraph.expander.graph.model.Block;

import java.util.Map;

/**
 * Resolves expressions inside blocks.
 */
public interface AttributeRenderer {

    /**
     * Resolves, in place, as many attribute expressions of the view's blocks as can
     * currently be known.
     */
    void render(SubGraph subGraph);

    /**
     * Replaces iteration placeholders ({@code each.key}, {@code each.value},
     * {@code count.index}) in a freshly cloned block's config and attributes.
     */
    void substituteIterationReferences(Block block, Map<String, Object> replacements);
}
