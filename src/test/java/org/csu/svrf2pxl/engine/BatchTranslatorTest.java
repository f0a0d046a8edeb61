package org.csu.svrf2pxl.engine;

import org.csu.svrf2pxl.analysis.ClassifierOptions;
import org.csu.svrf2pxl.codegen.GenerationMode;
import org.csu.svrf2pxl.codegen.OperationTableLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class BatchTranslatorTest {

    @TempDir
    Path dir;

    private Translator translator;

    @BeforeEach
    void setUp() throws Exception {
        translator = new Translator(new OperationTableLoader().loadResource("operation-tables/icv-pxl.json"),
                GenerationMode.LENIENT, ClassifierOptions.defaults());
    }

    @Test
    void testEachFileGetsItsOwnResult() throws Exception {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            Path file = dir.resolve("deck" + i + ".svrf");
            Files.writeString(file, "LAYER L" + i + " " + i + "\nR" + i + " { WIDTH L" + i + " < 0.1 }");
            files.add(file);
        }
        Path broken = dir.resolve("broken.svrf");
        Files.writeString(broken, "LAYER A 1 $");
        files.add(2, broken);
        Path missing = dir.resolve("missing.svrf");
        files.add(missing);

        Map<Path, TranslationResult> results;
        try (BatchTranslator batch = new BatchTranslator(translator, 3, 10_000)) {
            results = batch.translateAll(files);
        }

        assertEquals(files, new ArrayList<>(results.keySet()));
        assertTrue(results.get(broken).isFailed());
        assertTrue(results.get(missing).isFailed());
        assertTrue(results.get(missing).failure().contains("missing.svrf"));
        for (int i = 0; i < 6; i++) {
            TranslationResult result = results.get(dir.resolve("deck" + i + ".svrf"));
            assertFalse(result.isFailed());
            assertTrue(result.output().contains("L" + i + " = layer(" + i + ", 0);"));
        }
    }

    @Test
    void testSlowFileTimesOut() throws Exception {
        Translator slow = Mockito.mock(Translator.class);
        Path file = dir.resolve("slow.svrf");
        when(slow.translate(any(Path.class))).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return null;
        });

        try (BatchTranslator batch = new BatchTranslator(slow, 1, 100)) {
            TranslationResult result = batch.translateAll(List.of(file)).get(file);
            assertTrue(result.isFailed());
            assertEquals("timed out after 100 ms", result.failure());
        }
    }

    @Test
    void testTimedOutTaskFreesItsThread() throws Exception {
        Translator slow = Mockito.mock(Translator.class);
        Path slowFile = dir.resolve("slow.svrf");
        Path nextFile = dir.resolve("next.svrf");
        TranslationResult quick = translator.translate("next.svrf", "LAYER M1 1");
        when(slow.translate(slowFile)).thenAnswer(invocation -> {
            Thread.sleep(60_000);
            return null;
        });
        when(slow.translate(nextFile)).thenReturn(quick);

        // one thread: the second file only runs once the first one gives its thread back
        try (BatchTranslator batch = new BatchTranslator(slow, 1, 500)) {
            Map<Path, TranslationResult> results = batch.translateAll(List.of(slowFile, nextFile));
            assertTrue(results.get(slowFile).isFailed());
            assertSame(quick, results.get(nextFile));
        }
    }
}
