package com.infragraph.expander.graph;

import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.ModuleInstanceKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Groups vertex indices by the module instantiation that lexically contains them.
 *
 * The {@code null} key stands for the root (blocks outside any module). Values handed
 * out by this class are either read-only views or copies; all mutation goes through
 * the methods below.
 */
public class MembershipIndex {

    private final Map<ModuleInstanceKey, Map<BlockType, List<Integer>>> entries = new LinkedHashMap<>();

    public boolean contains(ModuleInstanceKey key) {
        return entries.containsKey(key);
    }

    /**
     * Read-only view of an entry, empty if the key is unknown.
     */
    public Map<BlockType, List<Integer>> get(ModuleInstanceKey key) {
        Map<BlockType, List<Integer>> entry = entries.get(key);
        return entry == null ? Map.of() : Collections.unmodifiableMap(entry);
    }

    public List<Integer> members(ModuleInstanceKey key, BlockType type) {
        Map<BlockType, List<Integer>> entry = entries.get(key);
        if (entry == null || !entry.containsKey(type)) {
            return List.of();
        }
        return List.copyOf(entry.get(type));
    }

    /**
     * Independent copy of an entry, empty if the key is unknown.
     */
    public Map<BlockType, List<Integer>> snapshot(ModuleInstanceKey key) {
        Map<BlockType, List<Integer>> copy = new EnumMap<>(BlockType.class);
        Map<BlockType, List<Integer>> entry = entries.get(key);
        if (entry != null) {
            entry.forEach((type, indices) -> copy.put(type, new ArrayList<>(indices)));
        }
        return copy;
    }

    public void add(ModuleInstanceKey key, BlockType type, int vertexIndex) {
        entries.computeIfAbsent(key, k -> new EnumMap<>(BlockType.class))
                .computeIfAbsent(type, t -> new ArrayList<>())
                .add(vertexIndex);
    }

    public boolean removeMember(ModuleInstanceKey key, BlockType type, int vertexIndex) {
        Map<BlockType, List<Integer>> entry = entries.get(key);
        if (entry == null || !entry.containsKey(type)) {
            return false;
        }
        return entry.get(type).remove(Integer.valueOf(vertexIndex));
    }

    public void remove(ModuleInstanceKey key) {
        entries.remove(key);
    }

    /**
     * Moves an entry to a new key. Members already present under {@code newKey} are kept
     * and the moved members are appended after them.
     *
     * @return whether an entry existed under {@code oldKey}
     */
    public boolean rekey(ModuleInstanceKey oldKey, ModuleInstanceKey newKey) {
        if (Objects.equals(oldKey, newKey)) {
            return entries.containsKey(oldKey);
        }
        Map<BlockType, List<Integer>> moved = entries.remove(oldKey);
        if (moved == null) {
            return false;
        }
        Map<BlockType, List<Integer>> target = entries.computeIfAbsent(newKey, k -> new EnumMap<>(BlockType.class));
        moved.forEach((type, indices) -> target.computeIfAbsent(type, t -> new ArrayList<>()).addAll(indices));
        return true;
    }

    public Set<ModuleInstanceKey> keys() {
        return new LinkedHashSet<>(entries.keySet());
    }

    public int size() {
        return entries.size();
    }
}
