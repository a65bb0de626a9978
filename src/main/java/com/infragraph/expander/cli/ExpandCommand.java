package com.infragraph.expander.cli;

import com.infragraph.expander.cli.exception.OptionsValidationException;
import com.infragraph.expander.cli.model.ExpandOptions;
import com.infragraph.expander.cli.model.ValidatedExpandOptions;
import com.infragraph.expander.cli.output.ExpandResultsPrinter;
import com.infragraph.expander.cli.validation.ExpandOptionsValidator;
import com.infragraph.expander.foreach.ExpansionResult;
import com.infragraph.expander.foreach.ForeachModuleHandler;
import com.infragraph.expander.foreach.LiteralStatementResolver;
import com.infragraph.expander.foreach.VariableReferenceRenderer;
import com.infragraph.expander.foreach.exception.InvalidStatementKindException;
import com.infragraph.expander.graph.GraphStore;
import com.infragraph.expander.graph.exception.GraphLoadException;
import com.infragraph.expander.graph.io.GraphSnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command that loads a graph snapshot and expands for_each/count on its module calls.
 */
@Command(
        name = "expand",
        mixinStandardHelpOptions = true,
        version = "module-foreach-expander 1.0.0",
        description = "Multiplies module calls carrying for_each/count in a configuration graph snapshot."
)
public class ExpandCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExpandCommand.class);

    @Mixin
    private ExpandOptions options = new ExpandOptions();

    private final ExpandOptionsValidator validator = new ExpandOptionsValidator();
    private final ExpandResultsPrinter printer = new ExpandResultsPrinter();

    @Override
    public Integer call() {
        ValidatedExpandOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(validated);

        try {
            GraphStore graph = new GraphSnapshotLoader().load(validated.getGraphFile());

            List<Integer> candidates = validated.getCandidates() != null
                    ? validated.getCandidates()
                    : graph.findModulesWithIteration();
            for (int idx : candidates) {
                if (idx >= graph.size()) {
                    log.error("Candidate vertex {} is outside the graph ({} vertices)", idx, graph.size());
                    return 1;
                }
            }

            ForeachModuleHandler handler = new ForeachModuleHandler(graph, new LiteralStatementResolver(),
                    new VariableReferenceRenderer(), validated.getExpanderConfig());
            ExpansionResult result = handler.handle(candidates);

            printer.printSuccess(result, graph);
            return result.getMembershipViolations().isEmpty() ? 0 : 2;

        } catch (GraphLoadException e) {
            log.error("Could not load graph: {}", e.getMessage());
            return 1;
        } catch (InvalidStatementKindException e) {
            log.error("Expansion failed: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Expansion failed with exception", e);
            return 1;
        }
    }
}
