package com.infragraph.expander.graph.model;

import com.infragraph.expander.util.ConfigTrees;
import com.infragraph.expander.util.InstanceNamingUtil;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A configuration unit (module call, resource, variable, ...) stored as a graph vertex.
 */
@Data
@NoArgsConstructor
public class Block {

    public static final String FOREACH_ATTRIBUTE = "for_each";
    public static final String COUNT_ATTRIBUTE = "count";

    private BlockType blockType;

    /** Declaration site (file) of the block. */
    private String path;

    /** Logical name; carries the instance suffix once the block is multiplied. */
    private String name;

    private Map<String, Object> config = new LinkedHashMap<>();
    private Map<String, Object> attributes = new LinkedHashMap<>();

    /** Module instantiation this block lives in, {@code null} at the root. */
    private ModuleInstanceKey sourceModuleObject;

    /** Vertex index of the owning module call. Reference only. */
    private Set<Integer> sourceModule = new LinkedHashSet<>();

    /** Key of the instance this block is, {@code null} until multiplied. */
    private Object forEachIndex;

    @Builder
    public Block(BlockType blockType, String path, String name, Map<String, Object> config,
                 Map<String, Object> attributes, ModuleInstanceKey sourceModuleObject,
                 Set<Integer> sourceModule, Object forEachIndex) {
        this.blockType = blockType;
        this.path = path;
        this.name = name;
        this.config = config != null ? ConfigTrees.deepCopy(config) : new LinkedHashMap<>();
        this.attributes = attributes != null ? ConfigTrees.deepCopy(attributes) : new LinkedHashMap<>();
        this.sourceModuleObject = sourceModuleObject;
        this.sourceModule = sourceModule != null ? new LinkedHashSet<>(sourceModule) : new LinkedHashSet<>();
        this.forEachIndex = forEachIndex;
    }

    public String getBaseName() {
        return InstanceNamingUtil.baseName(name);
    }

    public boolean isInstance() {
        return forEachIndex != null;
    }

    public Object getForEachStatement() {
        return attributes.get(FOREACH_ATTRIBUTE);
    }

    public Object getCountStatement() {
        return attributes.get(COUNT_ATTRIBUTE);
    }

    public boolean hasIterationStatement() {
        return getForEachStatement() != null || getCountStatement() != null;
    }

    /**
     * Identity of the instantiation this module block creates. Only meaningful for
     * {@link BlockType#MODULE} blocks.
     */
    public ModuleInstanceKey ownModuleKey() {
        return new ModuleInstanceKey(path, getBaseName(), sourceModuleObject, forEachIndex);
    }

    /**
     * The attribute map inside {@link #config} that belongs to this block:
     * {@code config[type][name]} for resources ({@code name} is {@code type.name}),
     * {@code config[name]} otherwise. Returns {@code null} if absent.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getConfigBody() {
        String baseName = getBaseName();
        if (baseName == null) {
            return null;
        }
        Object body;
        if (blockType == BlockType.RESOURCE && baseName.contains(".")) {
            int dot = baseName.indexOf('.');
            Object byType = config.get(baseName.substring(0, dot));
            body = byType instanceof Map<?, ?> m ? m.get(baseName.substring(dot + 1)) : null;
        } else {
            body = config.get(baseName);
        }
        return body instanceof Map<?, ?> ? (Map<String, Object>) body : null;
    }

    /**
     * Resolved module references recorded in the config body, empty if none.
     */
    public List<Object> getResolvedModuleEntries() {
        Map<String, Object> body = getConfigBody();
        if (body != null && body.get(ResolvedModuleReference.ENTRY_NAME) instanceof List<?> entries) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) entries;
            return list;
        }
        return List.of();
    }

    /**
     * Value copy: no mutable state is shared with this block.
     */
    public Block deepCopy() {
        return new Block(blockType, path, name, config, attributes, sourceModuleObject, sourceModule, forEachIndex);
    }
}
