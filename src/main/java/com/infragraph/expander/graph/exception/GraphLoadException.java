package com.infragraph.expander.graph.exception;

/**
 * A graph snapshot could not be read or does not describe a valid graph.
 */
public class GraphLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GraphLoadException(String message) {
        super(message);
    }

    public GraphLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
