package org.csu.svrf2pxl.cli;

import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of {@link TranslatorCli}.
 */
@Getter
public class CommandLineOptions {

    static final String USAGE = String.join("\n",
            "Usage: svrf2pxl -i <deck.svrf> [-i <deck.svrf> ...] [options]",
            "  -i, --input <file>       SVRF rule deck to translate (repeatable)",
            "  -o, --output <path>      output file; a directory when several inputs are given",
            "  -r, --reference <file>   existing PXL deck to compare the translation with",
            "  -t, --table <file>       operation table JSON (default: bundled icv-pxl table)",
            "      --strict             fail when an operation has no table entry",
            "      --stats              print translation statistics",
            "      --report             print the variable mapping report (needs --reference)",
            "      --sync-script <file> write statements missing from the reference deck",
            "      --fail-on-mismatch   exit 1 when symbols exist on only one side",
            "  -j, --threads <n>        parallel translations for several inputs (default 4)",
            "      --timeout <seconds>  per-file time limit for several inputs (default 60)",
            "  -v, --verbose            debug logging",
            "  -h, --help               show this help");

    private final List<Path> inputs = new ArrayList<>();
    private Path output;
    private Path reference;
    private Path table;
    private Path syncScript;
    private boolean strict;
    private boolean stats;
    private boolean report;
    private boolean failOnMismatch;
    private boolean verbose;
    private boolean help;
    private int threads = 4;
    private long timeoutSeconds = 60;

    /**
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad combination
     */
    public static CommandLineOptions parse(String[] args) {
        CommandLineOptions options = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-i", "--input" -> options.inputs.add(Path.of(value(args, ++i, arg)));
                case "-o", "--output" -> options.output = Path.of(value(args, ++i, arg));
                case "-r", "--reference" -> options.reference = Path.of(value(args, ++i, arg));
                case "-t", "--table" -> options.table = Path.of(value(args, ++i, arg));
                case "--sync-script" -> options.syncScript = Path.of(value(args, ++i, arg));
                case "--strict" -> options.strict = true;
                case "--stats" -> options.stats = true;
                case "--report" -> options.report = true;
                case "--fail-on-mismatch" -> options.failOnMismatch = true;
                case "-v", "--verbose" -> options.verbose = true;
                case "-h", "--help" -> options.help = true;
                case "-j", "--threads" -> options.threads = positive(value(args, ++i, arg), arg);
                case "--timeout" -> options.timeoutSeconds = positive(value(args, ++i, arg), arg);
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    options.inputs.add(Path.of(arg));
                }
            }
        }
        if (options.help) {
            return options;
        }
        if (options.inputs.isEmpty()) {
            throw new IllegalArgumentException("No input deck given");
        }
        boolean comparing = options.report || options.syncScript != null || options.failOnMismatch;
        if (comparing && options.reference == null) {
            throw new IllegalArgumentException("--report, --sync-script and --fail-on-mismatch need --reference");
        }
        if (options.reference != null && options.inputs.size() > 1) {
            throw new IllegalArgumentException("--reference compares a single input deck");
        }
        return options;
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int positive(String text, String flag) {
        try {
            int value = Integer.parseInt(text);
            if (value <= 0) {
                throw new IllegalArgumentException(flag + " must be positive: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number: " + text, e);
        }
    }
}
