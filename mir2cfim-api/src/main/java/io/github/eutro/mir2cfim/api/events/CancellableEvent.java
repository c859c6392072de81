package io.github.eutro.mir2cfim.api.events;

/**
 * A stage event whose hooks can veto the stage.
 * <p>
 * Once vetoed, hooks registered after the vetoing one do not see the event, and the compilation
 * skips the stage, for example {@link EmitDeclarationEvent not emitting} a declaration.
 */
public interface CancellableEvent {
    /**
     * @return Whether a hook has vetoed the stage.
     */
    boolean isCancelled();

    /**
     * Veto the stage.
     */
    void cancel();
}
