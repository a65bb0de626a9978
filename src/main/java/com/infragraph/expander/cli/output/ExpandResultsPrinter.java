package com.infragraph.expander.cli.output;

import com.infragraph.expander.cli.model.ValidatedExpandOptions;
import com.infragraph.expander.foreach.ExpansionResult;
import com.infragraph.expander.graph.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Responsible only for printing CLI output for the "expand" command.
 * No validation, no execution.
 */
public class ExpandResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExpandResultsPrinter.class);

    public void printBanner(ValidatedExpandOptions v) {
        log.info("=================================================");
        log.info("Module for_each Expander");
        log.info("=================================================");
        log.info("Graph Snapshot: {}", v.getGraphFile());
        log.info("Candidates: {}", v.getCandidates() != null ? v.getCandidates() : "scan graph");
        log.info("Max Rounds: {}", v.getExpanderConfig().getMaxRounds());
        log.info("Retry Unresolved: {}", v.getExpanderConfig().isRetryUnresolved());
        log.info("Verify Membership: {}", v.getExpanderConfig().isVerifyMembership());
        log.info("=================================================");
    }

    public void printSuccess(ExpansionResult result, GraphStore graph) {
        log.info("");
        log.info("=================================================");
        log.info("EXPANSION FINISHED");
        log.info("=================================================");
        log.info("Rounds: {}", result.getRounds());
        log.info("Modules Expanded: {}", result.getModulesExpanded());
        log.info("Instances Created: {}", result.getInstancesCreated());
        log.info("Vertices: {} -> {}", result.getVerticesBefore(), result.getVerticesAfter());
        log.info("Membership Entries: {}", graph.getMembership().size());

        if (result.hasUnresolvedModules()) {
            log.info("");
            log.info("Unresolved Modules:");
            for (int idx : result.getUnresolvedModules()) {
                log.info("  [{}] {}", idx, graph.getVertex(idx).getName());
            }
        }

        List<String> violations = result.getMembershipViolations();
        if (!violations.isEmpty()) {
            log.info("");
            log.info("Membership Violations: {}", violations.size());
            violations.forEach(v -> log.info("  {}", v));
        }
        log.info("=================================================");
    }
}
