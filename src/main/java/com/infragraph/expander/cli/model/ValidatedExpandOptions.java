package com.infragraph.expander.cli.model;

import com.infragraph.expander.foreach.ExpanderConfig;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Derived values needed by the executor. Keeps ExpandCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExpandOptions {
    Path graphFile;
    /** {@code null} when candidates should be found by scanning the graph. */
    List<Integer> candidates;
    ExpanderConfig expanderConfig;
}
