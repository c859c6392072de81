package io.github.eutro.mir2cfim.api.events;

import com.google.common.flogger.GoogleLogger;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * A class on which events can be listened to and dispatched.
 * <p>
 * Listeners are called in the order they were added. Events may be dispatched from several threads at once,
 * when declarations are structured in parallel, so listeners may be added and called concurrently.
 *
 * @param <S> The type of events that can be listened to or dispatched.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final Map<Class<?>, CopyOnWriteArrayList<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()).addIfAbsent(listener);
    }

    @SuppressWarnings("unchecked")
    private <T> List<Consumer<T>> listenersOf(Class<T> eventClass) {
        List<Consumer<?>> forClass = listeners.get(eventClass);
        return forClass == null ? Collections.emptyList() : (List<Consumer<T>>) (Object) forClass;
    }

    /**
     * Dispatch an event to listeners, stopping early if it is {@link CancellableEvent cancelled}.
     *
     * @param eventClass The exact type of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event, after every listener has seen it.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        List<Consumer<T>> eventListeners = listenersOf(eventClass);
        logger.atFinest().log("dispatching %s to %d listener(s)", eventClass.getSimpleName(), eventListeners.size());
        CancellableEvent cancellable = event instanceof CancellableEvent ? (CancellableEvent) event : null;
        for (Consumer<T> consumer : eventListeners) {
            if (cancellable != null && cancellable.isCancelled()) break;
            consumer.accept(event);
        }
        return event;
    }
}
