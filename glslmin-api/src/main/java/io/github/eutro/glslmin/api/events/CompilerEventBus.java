package io.github.eutro.glslmin.api.events;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A {@link CompilerEventSource} that fires events at its listeners, in the order they were added.
 */
public class CompilerEventBus implements CompilerEventSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompilerEventBus.class);

    private final Map<Class<? extends CompilerEvent>, List<Listener<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends CompilerEvent> void listen(Class<T> eventClass,
                                                 @NotNull String name,
                                                 @NotNull Consumer<? super T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).add(new Listener<>(name, listener));
    }

    @Override
    public <T extends CompilerEvent> void listen(Class<T> eventClass, @NotNull Consumer<? super T> listener) {
        List<Listener<?>> existing = listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>());
        existing.add(new Listener<>(eventClass.getSimpleName() + " listener #" + (existing.size() + 1), listener));
    }

    /**
     * Fire an event at the listeners of its class.
     * <p>
     * Once a {@link CancellableEvent} is cancelled, it is stamped with the name of the
     * listener that cancelled it and the remaining listeners don't see it.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    @SuppressWarnings("unchecked")
    public <T extends CompilerEvent> T dispatch(Class<T> eventClass, T event) {
        CancellableEvent cancellable = event instanceof CancellableEvent ? (CancellableEvent) event : null;
        for (Listener<?> listener : listeners.getOrDefault(eventClass, Collections.emptyList())) {
            if (cancellable != null && cancellable.isCancelled()) break;
            ((Listener<T>) listener).consumer.accept(event);
            if (cancellable != null && cancellable.isCancelled() && cancellable.getCancelledBy() == null) {
                cancellable.cancelledBy = listener.name;
                LOGGER.debug("{} cancelled by {}", eventClass.getSimpleName(), listener.name);
            }
        }
        return event;
    }

    private static class Listener<T> {
        final String name;
        final Consumer<? super T> consumer;

        Listener(String name, Consumer<? super T> consumer) {
            this.name = name;
            this.consumer = consumer;
        }
    }
}
