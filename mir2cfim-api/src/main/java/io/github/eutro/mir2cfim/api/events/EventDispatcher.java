package io.github.eutro.mir2cfim.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that announces the stages of a compilation, such as a {@link io.github.eutro.mir2cfim.api.CfimCompiler}
 * or a crate being compiled by one.
 *
 * @param <S> The common supertype of the stage events it announces.
 */
public interface EventDispatcher<S> {
    /**
     * Register a hook for one kind of stage event.
     * <p>
     * The hook is matched on {@code eventClass} itself, so hooks for a supertype or subtype
     * of the fired event are not run. Hooks run in registration order, on the thread that
     * fires the event.
     *
     * @param eventClass The class of the stage event.
     * @param listener   The hook.
     * @param <T>        The stage event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}
