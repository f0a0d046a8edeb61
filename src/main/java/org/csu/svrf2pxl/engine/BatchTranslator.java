package org.csu.svrf2pxl.engine;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Translates several files in parallel, one task per file. Each file gets its own result;
 * a failure or timeout in one file never affects another. A timed-out task is interrupted
 * and {@link Translator} stops it at the next stage boundary, freeing its pool thread.
 */
@Slf4j
public class BatchTranslator implements AutoCloseable {

    private final Translator translator;
    private final ExecutorService executor;
    private final long timeoutMillis;

    public BatchTranslator(Translator translator, int threads, long timeoutMillis) {
        this.translator = translator;
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * @return one result per input file, in input order
     */
    public Map<Path, TranslationResult> translateAll(List<Path> files) throws InterruptedException {
        List<Future<TranslationResult>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(executor.submit(() -> {
                try {
                    return translator.translate(file);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }));
        }
        Map<Path, TranslationResult> results = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            results.put(file, await(file, futures.get(i)));
        }
        return results;
    }

    private TranslationResult await(Path file, Future<TranslationResult> future) throws InterruptedException {
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Translation of {} timed out after {} ms", file, timeoutMillis);
            return TranslationResult.failed(file.toString(), List.of(), "timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.warn("Translation of {} failed: {}", file, cause.getMessage());
            return TranslationResult.failed(file.toString(), List.of(), String.valueOf(cause.getMessage()));
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
