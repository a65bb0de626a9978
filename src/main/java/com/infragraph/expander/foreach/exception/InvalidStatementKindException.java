package com.infragraph.expander.foreach.exception;

import lombok.Getter;

/**
 * Raised when a resolved {@code for_each} is neither a collection nor a mapping, or a
 * resolved {@code count} is not a non-negative integer.
 */
@Getter
public class InvalidStatementKindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int blockIndex;
    private final String blockName;
    private final String statementName;
    private final transient Object value;

    public InvalidStatementKindException(int blockIndex, String blockName, String statementName, Object value) {
        super(String.format("Invalid %s statement on block %d (%s): %s [%s]",
                statementName, blockIndex, blockName, value,
                value == null ? "null" : value.getClass().getSimpleName()));
        this.blockIndex = blockIndex;
        this.blockName = blockName;
        this.statementName = statementName;
        this.value = value;
    }
}
