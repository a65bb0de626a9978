package com.infragraph.expander.graph.model;

import lombok.Value;
import lombok.With;

/**
 * A module definition that a block's configuration was resolved against.
 *
 * Stored under {@link #ENTRY_NAME} inside a block's config body so that later
 * lookups can find the module instantiation the definition came from.
 */
@Value
public class ResolvedModuleReference {

    public static final String ENTRY_NAME = "__resolved__";

    String definitionPath;

    @With
    ModuleInstanceKey sourceModule;
}
