package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.SubGraph;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import com.infragraph.expander.util.ConfigTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Minimal renderer: resolves attributes that are a single {@code var.NAME} reference.
 *
 * The variable is looked up among the VARIABLE blocks of the referring block's own
 * module instantiation. Its value is the matching input of the module call that created
 * that instantiation, or the variable's {@code default} when the call does not set it.
 * A value that is itself still a reference is left alone.
 */
public class VariableReferenceRenderer implements AttributeRenderer {
    private static final Logger log = LoggerFactory.getLogger(VariableReferenceRenderer.class);

    private static final String VAR_PREFIX = "var.";
    private static final String DEFAULT_ATTRIBUTE = "default";

    @Override
    public void render(SubGraph subGraph) {
        int resolved = 0;
        for (int index : subGraph.indices()) {
            Block block = subGraph.vertex(index).orElseThrow();
            for (Map.Entry<String, Object> attribute : block.getAttributes().entrySet()) {
                if (!(attribute.getValue() instanceof String raw)) {
                    continue;
                }
                String variableName = variableName(raw);
                if (variableName == null) {
                    continue;
                }
                Optional<Object> value = lookupVariable(subGraph.getGraph(), block, variableName);
                if (value.isPresent()) {
                    Object copy = ConfigTrees.deepCopy(value.get());
                    attribute.setValue(copy);
                    Map<String, Object> body = block.getConfigBody();
                    if (body != null && body.containsKey(attribute.getKey())) {
                        body.put(attribute.getKey(), ConfigTrees.deepCopy(copy));
                    }
                    resolved++;
                }
            }
        }
        log.debug("Rendered {} variable reference(s) over {} vertices", resolved, subGraph.size());
    }

    @Override
    public void substituteIterationReferences(Block block, Map<String, Object> replacements) {
        ConfigTrees.substitute(block.getConfig(), replacements);
        ConfigTrees.substitute(block.getAttributes(), replacements);
    }

    private static String variableName(String raw) {
        String expression = ConfigTrees.unwrapInterpolation(raw);
        if (expression == null || !expression.startsWith(VAR_PREFIX)) {
            return null;
        }
        String name = expression.substring(VAR_PREFIX.length());
        return name.isEmpty() || name.contains(".") ? null : name;
    }

    private Optional<Object> lookupVariable(GraphStore graph, Block block, String variableName) {
        ModuleInstanceKey owner = block.getSourceModuleObject();
        boolean declared = false;
        Object defaultValue = null;
        for (int idx : graph.getMembership().members(owner, BlockType.VARIABLE)) {
            Block variable = graph.getVertex(idx);
            if (variableName.equals(variable.getBaseName())) {
                declared = true;
                defaultValue = variable.getAttributes().get(DEFAULT_ATTRIBUTE);
                break;
            }
        }
        if (!declared) {
            return Optional.empty();
        }
        if (owner != null) {
            Optional<Block> call = findModuleCall(graph, block, owner);
            if (call.isPresent() && call.get().getAttributes().containsKey(variableName)) {
                Object input = call.get().getAttributes().get(variableName);
                return ConfigTrees.isResolved(input) ? Optional.of(input) : Optional.empty();
            }
        }
        return ConfigTrees.isResolved(defaultValue) ? Optional.of(defaultValue) : Optional.empty();
    }

    private Optional<Block> findModuleCall(GraphStore graph, Block block, ModuleInstanceKey owner) {
        for (int idx : block.getSourceModule()) {
            if (idx >= 0 && idx < graph.size() && owner.equals(graph.getVertex(idx).ownModuleKey())) {
                return Optional.of(graph.getVertex(idx));
            }
        }
        for (int idx : graph.getMembership().members(owner.getNestedModule(), BlockType.MODULE)) {
            if (owner.equals(graph.getVertex(idx).ownModuleKey())) {
                return Optional.of(graph.getVertex(idx));
            }
        }
        return Optional.empty();
    }
}
