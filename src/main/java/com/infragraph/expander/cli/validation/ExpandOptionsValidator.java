package com.infragraph.expander.cli.validation;

import com.infragraph.expander.cli.exception.OptionsValidationException;
import com.infragraph.expander.cli.model.ExpandOptions;
import com.infragraph.expander.cli.model.ValidatedExpandOptions;
import com.infragraph.expander.foreach.ExpanderConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ExpandOptionsValidator {

	public ValidatedExpandOptions validate(ExpandOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getGraphFile() == null) {
			errors.add("Graph snapshot is required (--graph / -g).");
		} else if (!Files.isRegularFile(o.getGraphFile())) {
			errors.add("Graph snapshot does not exist or is not a file: " + o.getGraphFile());
		}

		if (o.getMaxRounds() <= 0) {
			errors.add("Max rounds must be > 0. Got: " + o.getMaxRounds());
		}

		List<Integer> candidates = parseCandidates(o.getCandidates(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ExpanderConfig config = ExpanderConfig.builder()
				.maxRounds(o.getMaxRounds())
				.retryUnresolved(!o.isNoRetry())
				.verifyMembership(o.isVerify())
				.build();

		Path graphFile = o.getGraphFile().toAbsolutePath().normalize();
		return new ValidatedExpandOptions(graphFile, candidates, config);
	}

	private static List<Integer> parseCandidates(String raw, List<String> errors) {
		if (raw == null || raw.isBlank()) {
			return null;
		}

		Set<Integer> result = new LinkedHashSet<>();
		for (String token : raw.split(",")) {
			String t = token.trim();
			if (t.isEmpty()) {
				continue;
			}
			try {
				int idx = Integer.parseInt(t);
				if (idx < 0) {
					errors.add("Candidate vertex index must be >= 0. Got: " + t);
				} else {
					result.add(idx);
				}
			} catch (NumberFormatException e) {
				errors.add("Candidate vertex index is not a number: " + t);
			}
		}
		return List.copyOf(result);
	}
}
