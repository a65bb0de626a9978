package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.SubGraph;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.util.ConfigTrees;

/**
 * Treats a statement as static once it no longer contains any reference expression.
 * A numeric string {@code count} is returned as an integer; any other literal string is
 * returned unchanged and rejected when the module is expanded.
 */
public class LiteralStatementResolver implements StatementResolver {

    @Override
    public boolean isStatic(Block block, SubGraph subGraph) {
        return ConfigTrees.isResolved(statementOf(block));
    }

    @Override
    public Object resolve(Block block, SubGraph subGraph) {
        Object statement = statementOf(block);
        if (block.getForEachStatement() == null && statement instanceof String s && isInteger(s.trim())) {
            return Integer.valueOf(s.trim());
        }
        return statement;
    }

    private static Object statementOf(Block block) {
        Object forEach = block.getForEachStatement();
        return forEach != null ? forEach : block.getCountStatement();
    }

    private static boolean isInteger(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit) && s.length() < 10;
    }
}
