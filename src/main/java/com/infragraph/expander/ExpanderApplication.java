package com.infragraph.expander;

import com.infragraph.expander.cli.ExpandCommand;
import picocli.CommandLine;

/**
 * Main entry point for the module for_each expander.
 * Loads a configuration graph snapshot and multiplies every module call whose
 * for_each/count can be resolved.
 */
public class ExpanderApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExpandCommand()).execute(args);
        System.exit(exitCode);
    }
}
