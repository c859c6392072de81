package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CrateCompilation;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a structured declaration should be emitted. This happens once every declaration has been
 * structured, in submission order, on the thread running the compilation.
 * <p>
 * A cancelled declaration is left out of the {@link io.github.eutro.mir2cfim.api.CompilationResult result}.
 *
 * @see CrateCompilation
 */
public class EmitDeclarationEvent implements CrateCompileEvent, CancellableEvent {
    /**
     * The declaration to be emitted.
     */
    @NotNull
    public FunDecl decl;
    private boolean cancelled = false;

    /**
     * Construct a new declaration emit event.
     *
     * @param decl The declaration to emit.
     */
    public EmitDeclarationEvent(@NotNull FunDecl decl) {
        this.decl = decl;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public void cancel() {
        cancelled = true;
    }
}
