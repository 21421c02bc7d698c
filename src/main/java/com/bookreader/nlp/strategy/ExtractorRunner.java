package com.bookreader.nlp.strategy;

import com.bookreader.nlp.core.CancellationToken;
import com.bookreader.nlp.core.ExtractionCancelledException;
import com.bookreader.nlp.core.Paragraph;
import com.bookreader.nlp.core.RawDescription;
import com.bookreader.nlp.extractor.DescriptionExtractor;
import com.bookreader.nlp.extractor.ExtractorTimeoutException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs extractors over paragraphs on a bounded pool with a per-call time budget.
 *
 * <p>A call that times out or fails contributes an empty list; the run goes on with the
 * others. Cancelling the job's token aborts every in-flight call and the run throws
 * {@link ExtractionCancelledException}.</p>
 */
public class ExtractorRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractorRunner.class);
    private static final ClassLoader ENGINE_CLASSLOADER = ExtractorRunner.class.getClassLoader();

    private final ExecutorService executor;
    private final long timeoutMs;

    public ExtractorRunner(int poolSize, long timeoutMs) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got: " + poolSize);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0, got: " + timeoutMs);
        }
        this.executor = Executors.newFixedThreadPool(poolSize, threadFactory());
        this.timeoutMs = timeoutMs;
    }

    /**
     * Starts every extractor at once and waits for all of them against one shared deadline.
     *
     * @return output per extractor, in the iteration order of {@code extractors}
     */
    @NotNull
    public Map<String, List<RawDescription>> runParallel(
        @NotNull Map<String, DescriptionExtractor> extractors,
        @NotNull List<Paragraph> paragraphs,
        @NotNull CancellationToken token
    ) {
        token.throwIfCancelled();
        Map<String, Future<List<RawDescription>>> futures = new LinkedHashMap<>();
        extractors.forEach((name, extractor) -> futures.put(name, executor.submit(task(extractor, paragraphs, token))));

        Map<String, List<RawDescription>> results = new LinkedHashMap<>();
        try (CancellationToken.Registration ignored = token.onCancel(() -> cancelAll(futures))) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            for (Map.Entry<String, Future<List<RawDescription>>> entry : futures.entrySet()) {
                long remaining = deadline - System.nanoTime();
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), remaining, futures, token));
            }
        }
        token.throwIfCancelled();
        return results;
    }

    /**
     * Runs extractors one after another, each with its own time budget.
     */
    @NotNull
    public Map<String, List<RawDescription>> runSequential(
        @NotNull Map<String, DescriptionExtractor> extractors,
        @NotNull List<Paragraph> paragraphs,
        @NotNull CancellationToken token
    ) {
        Map<String, List<RawDescription>> results = new LinkedHashMap<>();
        for (Map.Entry<String, DescriptionExtractor> entry : extractors.entrySet()) {
            token.throwIfCancelled();
            Future<List<RawDescription>> future = executor.submit(task(entry.getValue(), paragraphs, token));
            Map<String, Future<List<RawDescription>>> single = Map.of(entry.getKey(), future);
            try (CancellationToken.Registration ignored = token.onCancel(() -> cancelAll(single))) {
                results.put(entry.getKey(), await(entry.getKey(), future,
                    TimeUnit.MILLISECONDS.toNanos(timeoutMs), single, token));
            }
        }
        token.throwIfCancelled();
        return results;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Extractor pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while shutting down extractor pool");
        }
    }

    private static Callable<List<RawDescription>> task(
        DescriptionExtractor extractor,
        List<Paragraph> paragraphs,
        CancellationToken token
    ) {
        return () -> {
            List<RawDescription> found = new ArrayList<>();
            for (Paragraph paragraph : paragraphs) {
                if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    throw new ExtractionCancelledException("Extractor '" + extractor.getName() + "' cancelled");
                }
                found.addAll(extractor.extract(paragraph));
            }
            return found;
        };
    }

    private List<RawDescription> await(
        String name,
        Future<List<RawDescription>> future,
        long remainingNanos,
        Map<String, Future<List<RawDescription>>> all,
        CancellationToken token
    ) {
        try {
            return future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn(new ExtractorTimeoutException(name, timeoutMs).getMessage());
            return List.of();
        } catch (CancellationException e) {
            if (token.isCancelled()) {
                throw new ExtractionCancelledException("Extraction cancelled while waiting for '" + name + "'");
            }
            LOG.warn("Extractor '{}' was cancelled", name);
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionCancelledException) {
                throw (ExtractionCancelledException) cause;
            }
            LOG.warn("Extractor '{}' failed: {}", name, cause.getMessage(), cause);
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(all);
            throw new ExtractionCancelledException("Interrupted while waiting for '" + name + "'");
        }
    }

    private static void cancelAll(Map<String, Future<List<RawDescription>>> futures) {
        futures.values().forEach(f -> f.cancel(true));
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(() -> {
                Thread.currentThread().setContextClassLoader(ENGINE_CLASSLOADER);
                task.run();
            }, "nlp-extractor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
