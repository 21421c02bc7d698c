package com.bookreader.nlp.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal passed by the caller into an extraction run.
 *
 * <p>Listeners registered with {@link #onCancel(Runnable)} run once, on the thread that calls
 * {@link #cancel()}, or immediately if the token is already cancelled.</p>
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Handle for removing a listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * @throws ExtractionCancelledException if the token was cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ExtractionCancelledException("Extraction cancelled by caller");
        }
    }
}
