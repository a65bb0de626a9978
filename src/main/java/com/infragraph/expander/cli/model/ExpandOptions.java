package com.infragraph.expander.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Holds all CLI options for the "expand" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExpandOptions {

	@Option(names = { "--graph", "-g" }, required = true, description = "JSON snapshot of the configuration graph")
	private Path graphFile;

	@Option(names = { "--candidates",
			"-c" }, description = "Module vertex indices carrying for_each/count (comma-separated). Defaults to a scan of the graph")
	private String candidates;

	@Option(names = { "--max-rounds" }, defaultValue = "64", description = "Upper bound on expansion rounds")
	private int maxRounds;

	@Option(names = { "--no-retry" }, description = "Do not retry modules whose statement is not static in later rounds")
	private boolean noRetry;

	@Option(names = { "--verify" }, defaultValue = "true", negatable = true, description = "Check membership index consistency after expansion")
	private boolean verify;

}
