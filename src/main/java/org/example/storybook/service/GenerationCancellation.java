package org.example.storybook.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked between provider calls. An in-flight call is
 * always allowed to finish.
 */
public final class GenerationCancellation {

    private static final GenerationCancellation NONE = new GenerationCancellation(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    private GenerationCancellation(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static GenerationCancellation create() {
        return new GenerationCancellation(true);
    }

    public static GenerationCancellation none() {
        return NONE;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String storyId) {
        if (isCancelled()) {
            throw new GenerationCancelledException("Generation cancelled for story " + storyId);
        }
    }
}
