package io.github.eutro.glslmin.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that fires {@link CompilerEvent}s, which can be listened to.
 * <p>
 * Only events of exactly the listened class reach a listener, not those of its subclasses.
 */
public interface CompilerEventSource {
    /**
     * Listen to an event type under a name, which is recorded on any
     * {@link CancellableEvent} the listener cancels.
     *
     * @param eventClass The event class.
     * @param name       The name of the listener.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends CompilerEvent> void listen(Class<T> eventClass, @NotNull String name, @NotNull Consumer<? super T> listener);

    /**
     * Listen to an event type, under a name generated from the event class,
     * such as {@code RunStepEvent listener #2}.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends CompilerEvent> void listen(Class<T> eventClass, @NotNull Consumer<? super T> listener);
}
