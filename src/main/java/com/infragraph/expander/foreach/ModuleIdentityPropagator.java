package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.MembershipIndex;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import com.infragraph.expander.graph.model.ResolvedModuleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Points every descendant of a freshly created module instance at that instance.
 *
 * Descendants still carry the identity of the module call as it was before it was
 * multiplied. The walk replaces that identity with the instance's key in each
 * descendant's {@code sourceModuleObject} chain and in the resolved module references
 * of its config, across nested module boundaries. When a nested module's own identity
 * changes, its membership entry is moved to the new key.
 */
public class ModuleIdentityPropagator {
    private static final Logger log = LoggerFactory.getLogger(ModuleIdentityPropagator.class);

    private final GraphStore graph;

    public ModuleIdentityPropagator(GraphStore graph) {
        this.graph = graph;
    }

    /**
     * Walks from the instance's own membership entry.
     */
    public int updateDescendantIdentity(ModuleInstanceKey instanceKey, ModuleInstanceKey originalModuleKey) {
        return updateDescendantIdentity(instanceKey, originalModuleKey, instanceKey);
    }

    /**
     * @param instanceKey       identity of the new instance
     * @param originalModuleKey identity of the module call before it was multiplied
     * @param startingKey       membership entry to start the walk from
     * @return number of descendants visited
     */
    public int updateDescendantIdentity(ModuleInstanceKey instanceKey, ModuleInstanceKey originalModuleKey,
                                        ModuleInstanceKey startingKey) {
        MembershipIndex membership = graph.getMembership();
        Deque<ModuleInstanceKey> worklist = new ArrayDeque<>();
        Set<ModuleInstanceKey> visited = new HashSet<>();
        worklist.add(startingKey);
        int updated = 0;

        while (!worklist.isEmpty()) {
            ModuleInstanceKey current = worklist.poll();
            if (!visited.add(current) || !membership.contains(current)) {
                continue;
            }
            // the entry may be re-keyed below, iterate over a copy
            Map<BlockType, List<Integer>> members = membership.snapshot(current);
            for (Map.Entry<BlockType, List<Integer>> group : members.entrySet()) {
                for (int childIndex : group.getValue()) {
                    Block child = graph.getVertex(childIndex);
                    ModuleInstanceKey previousOwnKey = group.getKey() == BlockType.MODULE ? child.ownModuleKey() : null;

                    child.setSourceModuleObject(
                            ModuleInstanceKey.rebind(child.getSourceModuleObject(), originalModuleKey, instanceKey));
                    rewriteResolvedReferences(child, originalModuleKey, instanceKey);
                    updated++;

                    if (previousOwnKey != null) {
                        ModuleInstanceKey ownKey = child.ownModuleKey();
                        if (!previousOwnKey.equals(ownKey) && membership.rekey(previousOwnKey, ownKey)) {
                            log.debug("Re-keyed nested module entry {} -> {}", previousOwnKey, ownKey);
                        }
                        worklist.add(ownKey);
                    }
                }
            }
        }
        log.debug("Updated identity of {} descendant(s) of {}", updated, instanceKey);
        return updated;
    }

    /**
     * Rewrites resolved module references in the block's config body that still point
     * at {@code originalModuleKey} (directly or through their nesting chain).
     */
    public static void rewriteResolvedReferences(Block block, ModuleInstanceKey originalModuleKey,
                                                 ModuleInstanceKey instanceKey) {
        List<Object> entries = block.getResolvedModuleEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) instanceof ResolvedModuleReference ref && ref.getSourceModule() != null) {
                ModuleInstanceKey rebound = ref.getSourceModule().rebind(originalModuleKey, instanceKey);
                if (rebound != ref.getSourceModule()) {
                    entries.set(i, ref.withSourceModule(rebound));
                }
            }
        }
    }
}
