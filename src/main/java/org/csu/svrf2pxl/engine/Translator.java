package org.csu.svrf2pxl.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.csu.svrf2pxl.analysis.ClassifierOptions;
import org.csu.svrf2pxl.analysis.MappingRecord;
import org.csu.svrf2pxl.analysis.VariableRelationshipClassifier;
import org.csu.svrf2pxl.codegen.GenerationMode;
import org.csu.svrf2pxl.codegen.GenerationResult;
import org.csu.svrf2pxl.codegen.OperationTable;
import org.csu.svrf2pxl.codegen.PxlCodeGenerator;
import org.csu.svrf2pxl.common.diagnostic.Diagnostic;
import org.csu.svrf2pxl.common.exception.LexException;
import org.csu.svrf2pxl.common.exception.ParseException;
import org.csu.svrf2pxl.common.exception.UnmappableOperationException;
import org.csu.svrf2pxl.compiler.ir.IrBuildResult;
import org.csu.svrf2pxl.compiler.ir.IrBuilder;
import org.csu.svrf2pxl.compiler.lexer.Lexer;
import org.csu.svrf2pxl.compiler.lexer.Token;
import org.csu.svrf2pxl.compiler.parser.Parser;
import org.csu.svrf2pxl.compiler.parser.ast.DeckNode;
import org.csu.svrf2pxl.target.PxlDeckReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * @description: 翻译流程的入口
 *
 * Runs one SVRF deck through lexer, parser, IR builder and generator, and optionally
 * classifies it against a reference PXL deck. A translator holds no per-run state and can
 * be shared between threads.
 * <p>
 * An interrupted thread stops at the next stage boundary with a {@link CancellationException}.
 */
@Slf4j
public class Translator {

    @Getter
    private final OperationTable table;
    @Getter
    private final GenerationMode mode;
    private final PxlCodeGenerator generator;
    private final VariableRelationshipClassifier classifier;
    private final PxlDeckReader referenceReader;

    public Translator(OperationTable table, GenerationMode mode, ClassifierOptions options) {
        this(table, mode, new PxlCodeGenerator(mode), new VariableRelationshipClassifier(options),
                new PxlDeckReader(table));
    }

    Translator(OperationTable table, GenerationMode mode, PxlCodeGenerator generator,
               VariableRelationshipClassifier classifier, PxlDeckReader referenceReader) {
        this.table = table;
        this.mode = mode;
        this.generator = generator;
        this.classifier = classifier;
        this.referenceReader = referenceReader;
    }

    public TranslationResult translate(Path file) throws IOException {
        return translate(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
    }

    public TranslationResult translate(String sourceName, String text) {
        List<Token> tokens;
        try {
            tokens = new Lexer(text).tokenize();
        } catch (LexException e) {
            log.debug("{}: {}", sourceName, e.getMessage());
            return TranslationResult.failed(sourceName, List.of(e.toDiagnostic()), e.getMessage());
        }
        stopIfInterrupted(sourceName, "parsing");
        Parser parser = new Parser(tokens);
        DeckNode deck = parser.parse();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ParseException error : parser.getErrors()) {
            diagnostics.add(error.toDiagnostic());
        }

        stopIfInterrupted(sourceName, "building the IR");
        IrBuildResult built = new IrBuilder().build(deck);
        diagnostics.addAll(built.diagnostics());

        stopIfInterrupted(sourceName, "generation");
        GenerationResult generated;
        try {
            generated = generator.generate(built.graph(), table);
        } catch (UnmappableOperationException e) {
            log.debug("{}: strict generation failed: {}", sourceName, e.getMessage());
            diagnostics.add(e.toDiagnostic());
            List<Diagnostic> all = List.copyOf(diagnostics);
            return new TranslationResult(sourceName, null, built.graph(), all, List.of(),
                    TranslationStatistics.of(built.graph(), all, null), e.getMessage());
        }
        diagnostics.addAll(generated.diagnostics());

        List<Diagnostic> all = List.copyOf(diagnostics);
        log.debug("{}: {} symbols, {} diagnostics", sourceName, built.graph().size(), all.size());
        return new TranslationResult(sourceName, generated.text(), built.graph(), all, generated.placeholders(),
                TranslationStatistics.of(built.graph(), all, generated), null);
    }

    private static void stopIfInterrupted(String sourceName, String stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.debug("{}: interrupted before {}", sourceName, stage);
            throw new CancellationException("Translation of " + sourceName + " interrupted before " + stage);
        }
    }

    /**
     * Reads a reference PXL deck with this translator's operation table.
     */
    public IrBuildResult readReference(Path file) throws IOException {
        return referenceReader.read(file);
    }

    public IrBuildResult readReference(String text) {
        return referenceReader.read(text);
    }

    public List<MappingRecord> classify(TranslationResult result, IrBuildResult reference) {
        return classifier.classify(result.graph(), reference == null ? null : reference.graph());
    }

    /**
     * Target statements for one symbol of a translated deck, for the sync script.
     *
     * @throws UnmappableOperationException if the table cannot express the symbol
     */
    public List<String> statementsFor(TranslationResult result, String symbol) {
        return result.graph().get(symbol)
                .map(node -> generator.statementsFor(node, table))
                .orElse(List.of());
    }
}
