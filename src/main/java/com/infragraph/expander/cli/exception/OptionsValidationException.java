package com.infragraph.expander.cli.exception;

import lombok.Getter;

import java.util.List;

/**
 * Carries every problem found in the "expand" options, so they can be reported at once.
 */
@Getter
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() + " invalid option(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
