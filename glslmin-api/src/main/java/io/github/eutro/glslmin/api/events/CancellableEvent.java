package io.github.eutro.glslmin.api.events;

import org.jetbrains.annotations.Nullable;

/**
 * A compiler event that can be cancelled, which stops it reaching further listeners
 * and, for some events, stops the thing it announces from happening.
 */
public abstract class CancellableEvent implements CompilerEvent {
    private boolean cancelled;
    @Nullable
    String cancelledBy;

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel the event.
     */
    public void cancel() {
        cancelled = true;
    }

    /**
     * Get the name of the listener that cancelled this event.
     *
     * @return The name, or null if the event is not cancelled or was cancelled outside a dispatch.
     */
    @Nullable
    public String getCancelledBy() {
        return cancelledBy;
    }
}
