package com.infragraph.expander.foreach;

import com.infragraph.expander.foreach.exception.InvalidStatementKindException;
import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.MembershipIndex;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import com.infragraph.expander.util.ConfigTrees;
import com.infragraph.expander.util.InstanceNamingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Multiplies a module call into one vertex per {@code for_each} entry or {@code count}
 * index, together with a full copy of everything declared inside it.
 *
 * <p>The first instance overwrites the original vertex slot and takes over the original
 * membership entry, so indices held elsewhere keep pointing at a valid module. Every other
 * instance is appended, registered next to the original in its parent's entry, and gets
 * its own copy of the descendant subtree. Once all instances exist, each one's
 * descendants are re-pointed at it by the {@link ModuleIdentityPropagator}.
 */
public class ModuleDuplicator {
    private static final Logger log = LoggerFactory.getLogger(ModuleDuplicator.class);

    private final GraphStore graph;
    private final AttributeRenderer renderer;
    private final ModuleIdentityPropagator propagator;

    public ModuleDuplicator(GraphStore graph, AttributeRenderer renderer) {
        this(graph, renderer, new ModuleIdentityPropagator(graph));
    }

    public ModuleDuplicator(GraphStore graph, AttributeRenderer renderer, ModuleIdentityPropagator propagator) {
        this.graph = graph;
        this.renderer = renderer;
        this.propagator = propagator;
    }

    /**
     * @param statement a mapping (instance key = entry key) or a collection
     *                  (instance key = element, duplicates collapse)
     * @return the keys of the created instances, in instance order
     */
    public List<ModuleInstanceKey> expandForEach(int blockIndex, Object statement) {
        Block main = graph.getVertex(blockIndex);
        List<InstanceSpec> instances = new ArrayList<>();
        if (statement instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Map<String, Object> replacements = new LinkedHashMap<>();
                replacements.put(ForeachConstants.EACH_KEY, entry.getKey());
                replacements.put(ForeachConstants.EACH_VALUE, entry.getValue());
                instances.add(new InstanceSpec(ConfigTrees.immutableCopy(entry.getKey()), replacements));
            }
        } else if (statement instanceof Collection<?> collection) {
            for (Object value : new LinkedHashSet<>(collection)) {
                Map<String, Object> replacements = new LinkedHashMap<>();
                replacements.put(ForeachConstants.EACH_KEY, value);
                replacements.put(ForeachConstants.EACH_VALUE, value);
                // the element becomes part of a ModuleInstanceKey
                instances.add(new InstanceSpec(ConfigTrees.immutableCopy(value), replacements));
            }
        } else {
            throw new InvalidStatementKindException(blockIndex, main.getName(), Block.FOREACH_ATTRIBUTE, statement);
        }
        return expand(blockIndex, main, instances);
    }

    /**
     * @param statement a non-negative integral number
     * @return the keys of the created instances, {@code 0..n-1}
     */
    public List<ModuleInstanceKey> expandCount(int blockIndex, Object statement) {
        Block main = graph.getVertex(blockIndex);
        int count = toCount(blockIndex, main, statement);
        List<InstanceSpec> instances = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> replacements = new LinkedHashMap<>();
            replacements.put(ForeachConstants.COUNT_INDEX, i);
            instances.add(new InstanceSpec(i, replacements));
        }
        return expand(blockIndex, main, instances);
    }

    private static int toCount(int blockIndex, Block main, Object statement) {
        if (statement instanceof Integer || statement instanceof Long
                || statement instanceof Short || statement instanceof Byte) {
            long n = ((Number) statement).longValue();
            if (n >= 0 && n <= Integer.MAX_VALUE) {
                return (int) n;
            }
        } else if (statement instanceof Number number) {
            double d = number.doubleValue();
            if (d >= 0 && d == Math.rint(d) && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
        }
        throw new InvalidStatementKindException(blockIndex, main.getName(), Block.COUNT_ATTRIBUTE, statement);
    }

    private List<ModuleInstanceKey> expand(int blockIndex, Block main, List<InstanceSpec> instances) {
        if (instances.isEmpty()) {
            log.debug("Module {} has no instances to create, leaving it as is", main.getName());
            return List.of();
        }
        ModuleInstanceKey originalKey = main.ownModuleKey();
        // taken before any instance touches the index
        Map<BlockType, List<Integer>> originalMembers = graph.getMembership().snapshot(originalKey);

        List<ModuleInstanceKey> created = new ArrayList<>(instances.size());
        for (int position = 0; position < instances.size(); position++) {
            created.add(cloneModule(main, instances.get(position), blockIndex, position, originalMembers));
        }

        // descendants are re-pointed only once every copy has been taken from the originals
        for (ModuleInstanceKey instanceKey : created) {
            propagator.updateDescendantIdentity(instanceKey, originalKey);
        }
        log.info("Expanded module {} into {} instance(s)", main.getName(), created.size());
        return created;
    }

    /**
     * Creates one instance of {@code main}.
     *
     * @param sourceIndex     vertex index of the original module call
     * @param position        0 for the instance that takes over the original slot
     * @param originalMembers members of the original instantiation, captured before expansion
     * @return the identity of the new instance
     */
    ModuleInstanceKey cloneModule(Block main, InstanceSpec instance, int sourceIndex, int position,
                                  Map<BlockType, List<Integer>> originalMembers) {
        MembershipIndex membership = graph.getMembership();
        ModuleInstanceKey originalKey = main.ownModuleKey();

        Block clone = main.deepCopy();
        renderer.substituteIterationReferences(clone, instance.replacements());
        clone.setForEachIndex(instance.key());
        clone.setName(InstanceNamingUtil.instanceName(main.getName(), instance.key()));
        ModuleInstanceKey instanceKey = clone.ownModuleKey();
        ModuleIdentityPropagator.rewriteResolvedReferences(clone, originalKey, instanceKey);

        if (position == 0) {
            graph.replaceVertex(sourceIndex, clone);
            membership.rekey(originalKey, instanceKey);
            log.debug("Instance {} of {} overrides vertex {}", instance.key(), main.getName(), sourceIndex);
            return instanceKey;
        }

        int cloneIndex = graph.append(clone);
        membership.add(clone.getSourceModuleObject(), BlockType.MODULE, cloneIndex);
        int copied = copyDescendants(originalMembers, instanceKey, cloneIndex);
        log.debug("Instance {} of {} appended at vertex {} with {} descendant(s)",
                instance.key(), main.getName(), cloneIndex, copied);
        return instanceKey;
    }

    /**
     * Copies every block reachable through {@code originalMembers}, nested module
     * instantiations included, under {@code ownerKey}.
     */
    private int copyDescendants(Map<BlockType, List<Integer>> originalMembers, ModuleInstanceKey ownerKey,
                                int ownerIndex) {
        MembershipIndex membership = graph.getMembership();
        Deque<CopyTask> worklist = new ArrayDeque<>();
        worklist.add(new CopyTask(originalMembers, ownerKey, ownerIndex));
        int copied = 0;

        while (!worklist.isEmpty()) {
            CopyTask task = worklist.poll();
            for (Map.Entry<BlockType, List<Integer>> group : task.members().entrySet()) {
                for (int originalIndex : group.getValue()) {
                    Block original = graph.getVertex(originalIndex);
                    Block copy = original.deepCopy();
                    copy.setSourceModuleObject(task.ownerKey());
                    copy.setSourceModule(new LinkedHashSet<>(Set.of(task.ownerIndex())));

                    int copyIndex = graph.append(copy);
                    membership.add(task.ownerKey(), group.getKey(), copyIndex);
                    copied++;

                    if (group.getKey() == BlockType.MODULE) {
                        ModuleInstanceKey nestedOriginalKey = original.ownModuleKey();
                        if (membership.contains(nestedOriginalKey)) {
                            worklist.add(new CopyTask(membership.snapshot(nestedOriginalKey),
                                    copy.ownModuleKey(), copyIndex));
                        }
                    }
                }
            }
        }
        return copied;
    }

    record InstanceSpec(Object key, Map<String, Object> replacements) {
    }

    private record CopyTask(Map<BlockType, List<Integer>> members, ModuleInstanceKey ownerKey, int ownerIndex) {
    }
}
