package org.csu.svrf2pxl.cli;

import org.csu.svrf2pxl.analysis.ClassifierOptions;
import org.csu.svrf2pxl.analysis.MappingRecord;
import org.csu.svrf2pxl.cli.tool.DiagnosticFormatter;
import org.csu.svrf2pxl.cli.tool.MappingReportFormatter;
import org.csu.svrf2pxl.cli.tool.StatisticsFormatter;
import org.csu.svrf2pxl.cli.tool.SyncScriptWriter;
import org.csu.svrf2pxl.codegen.GenerationMode;
import org.csu.svrf2pxl.codegen.OperationTable;
import org.csu.svrf2pxl.codegen.OperationTableLoader;
import org.csu.svrf2pxl.common.exception.TranslationException;
import org.csu.svrf2pxl.compiler.ir.IrBuildResult;
import org.csu.svrf2pxl.engine.BatchTranslator;
import org.csu.svrf2pxl.engine.TranslationResult;
import org.csu.svrf2pxl.engine.Translator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * svrf2pxl 命令行入口。
 * <p>
 * Exit status: 0 on success, 1 when a deck had fatal errors, an I/O step failed or
 * {@code --fail-on-mismatch} found unmatched symbols, 2 on a usage error.
 */
public final class TranslatorCli {

    static final String DEFAULT_TABLE = "operation-tables/icv-pxl.json";
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.org.csu.svrf2pxl";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    TranslatorCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new TranslatorCli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CommandLineOptions.USAGE);
            return USAGE;
        }
        if (options.isHelp()) {
            out.println(CommandLineOptions.USAGE);
            return OK;
        }
        if (options.isVerbose()) {
            // must happen before the first logger of this package is created
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        }

        try {
            OperationTableLoader loader = new OperationTableLoader();
            OperationTable table = options.getTable() != null
                    ? loader.load(options.getTable())
                    : loader.loadResource(DEFAULT_TABLE);
            GenerationMode mode = options.isStrict() ? GenerationMode.STRICT : GenerationMode.LENIENT;
            Translator translator = new Translator(table, mode, ClassifierOptions.defaults());

            Map<Path, TranslationResult> results = translateAll(translator, options);
            int status = OK;
            for (Map.Entry<Path, TranslationResult> entry : results.entrySet()) {
                status = Math.max(status, emit(entry.getKey(), entry.getValue(), options));
            }
            if (options.getReference() != null) {
                TranslationResult only = results.values().iterator().next();
                status = Math.max(status, compare(translator, only, options));
            }
            return status;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return FAILED;
        } catch (TranslationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return FAILED;
        }
    }

    private Map<Path, TranslationResult> translateAll(Translator translator, CommandLineOptions options)
            throws IOException, InterruptedException {
        if (options.getInputs().size() == 1) {
            Path input = options.getInputs().get(0);
            return Map.of(input, translator.translate(input));
        }
        try (BatchTranslator batch = new BatchTranslator(translator, options.getThreads(),
                options.getTimeoutSeconds() * 1000)) {
            return batch.translateAll(options.getInputs());
        }
    }

    private int emit(Path input, TranslationResult result, CommandLineOptions options) throws IOException {
        err.print(DiagnosticFormatter.formatAll(result.sourceName(), result.diagnostics(), options.isVerbose()));
        if (result.isFailed()) {
            err.println(result.sourceName() + ": translation failed: " + result.failure());
            return FAILED;
        }
        Path target = outputFor(input, options);
        if (target == null) {
            out.print(result.output());
        } else {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, result.output(), StandardCharsets.UTF_8);
            err.println(result.sourceName() + " -> " + target);
        }
        if (options.isStats()) {
            out.println(StatisticsFormatter.format(result.sourceName(), result.statistics()));
        }
        return result.hasFatalErrors() ? FAILED : OK;
    }

    /**
     * Null means standard output.
     */
    private static Path outputFor(Path input, CommandLineOptions options) {
        String name = input.getFileName().toString().replaceFirst("\\.[^.]+$", "") + ".rs";
        if (options.getInputs().size() == 1) {
            return options.getOutput();
        }
        if (options.getOutput() != null) {
            return options.getOutput().resolve(name);
        }
        return input.resolveSibling(name);
    }

    private int compare(Translator translator, TranslationResult result, CommandLineOptions options)
            throws IOException {
        if (result.isFailed()) {
            return FAILED;
        }
        IrBuildResult reference = translator.readReference(options.getReference());
        if (options.isVerbose()) {
            err.print(DiagnosticFormatter.formatAll(options.getReference().toString(), reference.diagnostics(), true));
        }
        List<MappingRecord> records = translator.classify(result, reference);
        if (options.isReport()) {
            out.println(MappingReportFormatter.format(records));
        }
        out.println(MappingReportFormatter.summary(records));
        if (options.getSyncScript() != null) {
            String script = new SyncScriptWriter(translator).write(result, records);
            Files.writeString(options.getSyncScript(), script, StandardCharsets.UTF_8);
            err.println("Sync script written to " + options.getSyncScript());
        }
        List<String> mismatches = MappingReportFormatter.mismatches(records);
        if (options.isFailOnMismatch() && !mismatches.isEmpty()) {
            mismatches.forEach(m -> err.println("Mismatch " + m));
            return FAILED;
        }
        return OK;
    }
}
