package com.infragraph.expander.foreach;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one {@link ForeachModuleHandler#handle} call.
 */
@Value
@Builder(toBuilder = true)
public class ExpansionResult {

    int rounds;
    int modulesExpanded;
    int instancesCreated;
    int verticesBefore;
    int verticesAfter;

    /** Modules whose iteration statement never became static. */
    @Singular("unresolvedModule")
    List<Integer> unresolvedModules;

    @Singular("membershipViolation")
    List<String> membershipViolations;

    public static ExpansionResult empty(int vertexCount) {
        return ExpansionResult.builder()
                .verticesBefore(vertexCount)
                .verticesAfter(vertexCount)
                .build();
    }

    public boolean hasUnresolvedModules() {
        return !unresolvedModules.isEmpty();
    }
}
