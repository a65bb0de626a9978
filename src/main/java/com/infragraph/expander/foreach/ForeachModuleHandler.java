package com.infragraph.expander.foreach;

import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.SubGraph;
import com.infragraph.expander.graph.model.Block;
import com.infragraph.expander.graph.model.BlockType;
import com.infragraph.expander.graph.model.ModuleInstanceKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands {@code for_each}/{@code count} on module calls, one nesting level per round.
 *
 * <p>Each round renders the graph restricted to the candidate blocks, then tries every
 * module of the current level. A module whose statement is static is multiplied; one
 * that is not yet static is retried in later rounds. The next level is made of the
 * modules declared inside the (now multiplied) modules of the current level, so an inner
 * module is only evaluated once every instance of its enclosing module exists and has
 * its own per-instance inputs.
 *
 * <p>For example, with {@code s3_module} and {@code s3_module2} at the root, each holding
 * an {@code inner_s3_module}: round one multiplies the two outer modules and copies their
 * inner modules into every instance, round two multiplies each copy of the inner modules.
 */
public class ForeachModuleHandler {
    private static final Logger log = LoggerFactory.getLogger(ForeachModuleHandler.class);

    private final GraphStore graph;
    private final StatementResolver resolver;
    private final AttributeRenderer renderer;
    private final ModuleDuplicator duplicator;
    private final ExpanderConfig config;

    public ForeachModuleHandler(GraphStore graph, StatementResolver resolver, AttributeRenderer renderer) {
        this(graph, resolver, renderer, ExpanderConfig.defaults());
    }

    public ForeachModuleHandler(GraphStore graph, StatementResolver resolver, AttributeRenderer renderer,
                                ExpanderConfig config) {
        this.graph = graph;
        this.resolver = resolver;
        this.renderer = renderer;
        this.config = config;
        this.duplicator = new ModuleDuplicator(graph, renderer);
    }

    /**
     * @param candidateModuleIndices module vertices known to carry {@code for_each} or {@code count}
     */
    public ExpansionResult handle(Collection<Integer> candidateModuleIndices) {
        if (candidateModuleIndices == null || candidateModuleIndices.isEmpty()) {
            return ExpansionResult.empty(graph.size());
        }
        List<Integer> candidates = List.copyOf(candidateModuleIndices);
        int verticesBefore = graph.size();
        log.info("Expanding for_each/count over {} candidate module(s), {} vertices", candidates.size(), verticesBefore);

        Set<ModuleInstanceKey> currentLevel = new LinkedHashSet<>();
        currentLevel.add(null);
        Set<Integer> pending = new LinkedHashSet<>();
        List<Integer> abandoned = new ArrayList<>();
        Set<Integer> modulesToRender = modulesOf(currentLevel);

        int rounds = 0;
        int modulesExpanded = 0;
        int instancesCreated = 0;

        while (!modulesToRender.isEmpty()) {
            if (rounds >= config.getMaxRounds()) {
                log.warn("Stopping after {} rounds with {} module(s) left to render", rounds, modulesToRender.size());
                break;
            }
            rounds++;

            SubGraph subGraph = graph.restrictTo(candidates);
            renderer.render(subGraph);

            Set<Integer> stillPending = new LinkedHashSet<>();
            Set<ModuleInstanceKey> reopened = new LinkedHashSet<>();
            int expandedThisRound = 0;
            for (int moduleIndex : modulesToRender) {
                ModuleOutcome outcome = processModule(moduleIndex, subGraph);
                if (outcome.status() == Status.UNRESOLVED) {
                    stillPending.add(moduleIndex);
                } else if (outcome.status() == Status.EXPANDED) {
                    expandedThisRound++;
                    instancesCreated += outcome.instances().size();
                    if (pending.contains(moduleIndex)) {
                        // its subtree was already walked under the old identity
                        reopened.addAll(outcome.instances());
                    }
                }
            }
            modulesExpanded += expandedThisRound;

            if (config.isRetryUnresolved()) {
                pending = stillPending;
            } else {
                abandoned.addAll(stillPending);
                pending = new LinkedHashSet<>();
            }

            Set<ModuleInstanceKey> nextLevel = nextLevel(currentLevel);
            nextLevel.addAll(reopened);
            Set<Integer> nextModules = modulesOf(nextLevel);
            log.debug("Round {}: {} module(s) rendered, {} expanded, {} pending, {} on next level",
                    rounds, modulesToRender.size(), expandedThisRound, pending.size(), nextModules.size());

            if (nextModules.isEmpty() && expandedThisRound == 0) {
                break;
            }
            currentLevel = nextLevel;
            modulesToRender = new LinkedHashSet<>(pending);
            modulesToRender.addAll(nextModules);
        }

        List<Integer> unresolved = new ArrayList<>(abandoned);
        unresolved.addAll(pending);
        for (int idx : unresolved) {
            log.warn("Module {} (vertex {}) left un-multiplied: iteration statement never became static",
                    graph.getVertex(idx).getName(), idx);
        }

        ExpansionResult.ExpansionResultBuilder result = ExpansionResult.builder()
                .rounds(rounds)
                .modulesExpanded(modulesExpanded)
                .instancesCreated(instancesCreated)
                .verticesBefore(verticesBefore)
                .verticesAfter(graph.size())
                .unresolvedModules(unresolved);
        if (config.isVerifyMembership()) {
            List<String> violations = graph.findMembershipViolations();
            violations.forEach(v -> log.warn("Membership violation: {}", v));
            result.membershipViolations(violations);
        }
        log.info("Expansion finished after {} round(s): {} module(s) expanded into {} instance(s), {} -> {} vertices",
                rounds, modulesExpanded, instancesCreated, verticesBefore, graph.size());
        return result.build();
    }

    private ModuleOutcome processModule(int moduleIndex, SubGraph subGraph) {
        Block block = graph.getVertex(moduleIndex);
        if (block.getBlockType() != BlockType.MODULE || block.isInstance()) {
            return ModuleOutcome.SKIPPED;
        }
        if (block.getForEachStatement() != null) {
            if (!resolver.isStatic(block, subGraph)) {
                log.debug("for_each of module {} is not static yet", block.getName());
                return ModuleOutcome.UNRESOLVED;
            }
            return ModuleOutcome.of(duplicator.expandForEach(moduleIndex, resolver.resolve(block, subGraph)));
        }
        if (block.getCountStatement() != null) {
            if (!resolver.isStatic(block, subGraph)) {
                log.debug("count of module {} is not static yet", block.getName());
                return ModuleOutcome.UNRESOLVED;
            }
            return ModuleOutcome.of(duplicator.expandCount(moduleIndex, resolver.resolve(block, subGraph)));
        }
        return ModuleOutcome.SKIPPED;
    }

    /**
     * Own keys of the modules declared directly in the given instantiations, read from the
     * live index so that freshly appended instances are included.
     */
    private Set<ModuleInstanceKey> nextLevel(Set<ModuleInstanceKey> level) {
        Set<ModuleInstanceKey> next = new LinkedHashSet<>();
        for (int moduleIndex : modulesOf(level)) {
            next.add(graph.getVertex(moduleIndex).ownModuleKey());
        }
        return next;
    }

    private Set<Integer> modulesOf(Set<ModuleInstanceKey> level) {
        Set<Integer> modules = new LinkedHashSet<>();
        for (ModuleInstanceKey key : level) {
            modules.addAll(graph.getMembership().members(key, BlockType.MODULE));
        }
        return modules;
    }

    private enum Status { EXPANDED, UNRESOLVED, SKIPPED }

    private record ModuleOutcome(Status status, List<ModuleInstanceKey> instances) {
        static final ModuleOutcome SKIPPED = new ModuleOutcome(Status.SKIPPED, List.of());
        static final ModuleOutcome UNRESOLVED = new ModuleOutcome(Status.UNRESOLVED, List.of());

        static ModuleOutcome of(List<ModuleInstanceKey> instances) {
            return instances.isEmpty() ? SKIPPED : new ModuleOutcome(Status.EXPANDED, instances);
        }
    }
}
