package com.infragraph.expander.graph.model;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Identity of one concrete module instantiation.
 *
 * The key is a chain: {@code nestedModule} points at the instantiation that lexically
 * contains this one ({@code null} for a module called from the root). A {@code null}
 * {@code foreachIndex} denotes the module call before it was multiplied.
 *
 * Instances are immutable, so a key installed in a map can never change its hash.
 * Every "modification" returns a new key.
 */
@Value
@AllArgsConstructor
public class ModuleInstanceKey {

    @NonNull
    String path;

    @NonNull
    String name;

    @With
    ModuleInstanceKey nestedModule;

    @With
    Object foreachIndex;

    public ModuleInstanceKey(String path, String name, ModuleInstanceKey nestedModule) {
        this(path, name, nestedModule, null);
    }

    public boolean hasForeachIndex() {
        return foreachIndex != null;
    }

    /**
     * Number of instantiations in the chain, this one included.
     */
    public int depth() {
        int depth = 0;
        for (ModuleInstanceKey k = this; k != null; k = k.nestedModule) {
            depth++;
        }
        return depth;
    }

    /**
     * Whether {@code ancestor} is this key or appears anywhere in its nesting chain.
     */
    public boolean isWithin(ModuleInstanceKey ancestor) {
        for (ModuleInstanceKey k = this; k != null; k = k.nestedModule) {
            if (k.equals(ancestor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of this chain with the first link equal to {@code original}
     * replaced by {@code replacement}. Returns {@code this} when the chain does not
     * contain {@code original}.
     */
    public ModuleInstanceKey rebind(ModuleInstanceKey original, ModuleInstanceKey replacement) {
        if (equals(original)) {
            return replacement;
        }
        if (nestedModule == null) {
            return this;
        }
        ModuleInstanceKey reboundParent = nestedModule.rebind(original, replacement);
        return reboundParent == nestedModule ? this : withNestedModule(reboundParent);
    }

    /**
     * Null-safe variant of {@link #rebind(ModuleInstanceKey, ModuleInstanceKey)}.
     */
    public static ModuleInstanceKey rebind(ModuleInstanceKey chain, ModuleInstanceKey original,
                                           ModuleInstanceKey replacement) {
        return chain == null ? null : chain.rebind(original, replacement);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (nestedModule != null) {
            sb.append(nestedModule).append(" > ");
        }
        sb.append(name);
        if (foreachIndex != null) {
            sb.append('[').append(foreachIndex).append(']');
        }
        sb.append('@').append(path);
        return sb.toString();
    }
}
