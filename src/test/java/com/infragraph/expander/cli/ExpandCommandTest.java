package com.infragraph.expander.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the "expand" command end to end on the snapshots under {@code src/test/resources/snapshots}.
 */
class ExpandCommandTest {

    @TempDir
    Path tempDir;

    private static String snapshot(String name) throws Exception {
        return Path.of(ExpandCommandTest.class.getResource("/snapshots/" + name).toURI()).toString();
    }

    private static int run(String... args) {
        return new CommandLine(new ExpandCommand()).execute(args);
    }

    @Test
    void testExpandSnapshotSucceeds() throws Exception {
        assertThat(run("--graph", snapshot("s3_foreach.json"))).isZero();
    }

    @Test
    void testExplicitCandidates() throws Exception {
        assertThat(run("-g", snapshot("s3_foreach.json"), "-c", "0,2", "--max-rounds", "3")).isZero();
    }

    @Test
    void testUnresolvedModulesDoNotFailTheRun() throws Exception {
        assertThat(run("-g", snapshot("unresolved_count.json"), "--no-retry")).isZero();
    }

    @Test
    void testInvalidStatementFails() throws Exception {
        assertThat(run("-g", snapshot("invalid_for_each.json"))).isEqualTo(1);
    }

    @Test
    void testCandidateOutsideGraphFails() throws Exception {
        assertThat(run("-g", snapshot("s3_foreach.json"), "-c", "17")).isEqualTo(1);
    }

    @Test
    void testValidationErrorsFail() {
        assertThat(run("-g", tempDir.resolve("missing.json").toString())).isEqualTo(1);
    }

    @Test
    void testMalformedSnapshotFails() throws Exception {
        Path file = Files.writeString(tempDir.resolve("broken.json"), "not json");

        assertThat(run("-g", file.toString())).isEqualTo(1);
    }
}
