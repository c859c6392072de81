package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CrateCompilation;
import io.github.eutro.mir2cfim.api.DeclarationFailure;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a declaration could not be structured.
 *
 * @see CrateCompilation
 */
public class DeclarationFailedEvent implements CrateCompileEvent {
    /**
     * The failure.
     */
    @NotNull
    public final DeclarationFailure failure;

    /**
     * Construct a new DeclarationFailedEvent.
     *
     * @param failure The failure.
     */
    public DeclarationFailedEvent(@NotNull DeclarationFailure failure) {
        this.failure = failure;
    }
}
