package com.infragraph.expander.foreach;

/**
 * Placeholder names available inside a multiplied block.
 */
public final class ForeachConstants {

    public static final String EACH_KEY = "each.key";
    public static final String EACH_VALUE = "each.value";
    public static final String COUNT_INDEX = "count.index";

    private ForeachConstants() {
        // Constants
    }
}
