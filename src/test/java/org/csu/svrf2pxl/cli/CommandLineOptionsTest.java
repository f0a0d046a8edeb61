package org.csu.svrf2pxl.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(args);
    }

    private static void assertRejected(String expectedMessage, String... args) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parse(args));
        assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
    }

    @Test
    void testDefaults() {
        CommandLineOptions options = parse("deck.svrf");

        assertEquals(List.of(Path.of("deck.svrf")), options.getInputs());
        assertNull(options.getOutput());
        assertNull(options.getTable());
        assertFalse(options.isStrict());
        assertEquals(4, options.getThreads());
        assertEquals(60, options.getTimeoutSeconds());
    }

    @Test
    void testAllOptions() {
        CommandLineOptions options = parse("-i", "a.svrf", "--output", "out.rs", "-r", "ref.rs", "-t", "t.json",
                "--sync-script", "sync.rs", "--strict", "--stats", "--report", "--fail-on-mismatch", "-v",
                "-j", "2", "--timeout", "5");

        assertEquals(Path.of("out.rs"), options.getOutput());
        assertEquals(Path.of("ref.rs"), options.getReference());
        assertEquals(Path.of("t.json"), options.getTable());
        assertEquals(Path.of("sync.rs"), options.getSyncScript());
        assertTrue(options.isStrict() && options.isStats() && options.isReport());
        assertTrue(options.isFailOnMismatch() && options.isVerbose());
        assertEquals(2, options.getThreads());
        assertEquals(5, options.getTimeoutSeconds());
    }

    @Test
    void testRepeatedAndBareInputs() {
        CommandLineOptions options = parse("-i", "a.svrf", "b.svrf", "--input", "c.svrf");
        assertEquals(List.of(Path.of("a.svrf"), Path.of("b.svrf"), Path.of("c.svrf")), options.getInputs());
    }

    @Test
    void testHelpNeedsNothingElse() {
        assertTrue(parse("--help").isHelp());
    }

    @Test
    void testRejectedCommandLines() {
        assertRejected("No input deck");
        assertRejected("Unknown option: --fast", "a.svrf", "--fast");
        assertRejected("Missing value for -o", "a.svrf", "-o");
        assertRejected("Missing value for -i", "-i", "--strict");
        assertRejected("need --reference", "a.svrf", "--report");
        assertRejected("need --reference", "a.svrf", "--sync-script", "s.rs");
        assertRejected("single input", "a.svrf", "b.svrf", "-r", "ref.rs");
        assertRejected("must be positive", "a.svrf", "-j", "0");
        assertRejected("expects a number", "a.svrf", "--timeout", "soon");
    }
}
