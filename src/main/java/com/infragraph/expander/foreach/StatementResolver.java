package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.SubGraph;
import com.infragraph.expander.graph.model.Block;

/**
 * Decides whether a block's iteration statement ({@code for_each}, else {@code count})
 * is fully resolved, and returns its value.
 */
public interface StatementResolver {

    boolean isStatic(Block block, SubGraph subGraph);

    /**
     * Only valid when {@link #isStatic(Block, SubGraph)} holds.
     *
     * @return a collection or mapping for {@code for_each}, an integer for {@code count}
     */
    Object resolve(Block block, SubGraph subGraph);
}
