package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CrateCompilation;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.FunDecl;
import org.jetbrains.annotations.NotNull;

/**
 * Fired just before the body of a declaration is structured.
 * <p>
 * Listeners may replace {@link #graph} to structure a different body.
 *
 * @see CrateCompilation
 */
public class ImPassesEvent implements CrateCompileEvent {
    /**
     * The declaration being structured.
     */
    @NotNull
    public final FunDecl decl;
    /**
     * The body to structure.
     */
    @NotNull
    public BlockGraph graph;

    /**
     * Construct a new ImPassesEvent.
     *
     * @param decl  The declaration.
     * @param graph The body to structure.
     */
    public ImPassesEvent(@NotNull FunDecl decl, @NotNull BlockGraph graph) {
        this.decl = decl;
        this.graph = graph;
    }
}
