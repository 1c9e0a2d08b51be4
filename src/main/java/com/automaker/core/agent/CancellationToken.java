package com.automaker.core.agent;

import com.automaker.core.errors.FeatureAbortedException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed down every call chain of a feature execution.
 * Callers poll {@link #isCancelled()} or call {@link #throwIfCancelled()} at each suspension point.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                listener.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new FeatureAbortedException("Feature execution aborted");
        }
    }

    /** Registers a callback run once on cancellation, immediately if already cancelled. */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get()) {
            listener.run();
        }
    }
}
