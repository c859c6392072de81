package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CrateCompilation;
import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.im.FunDecl;
import org.jetbrains.annotations.NotNull;

/**
 * Fired just after the body of a declaration has been structured (and its asserts reconstructed,
 * if enabled), to allow running extra passes on it.
 *
 * @see CrateCompilation
 */
public class CfimPassesEvent implements CrateCompileEvent {
    /**
     * The declaration the body was structured from.
     */
    @NotNull
    public final FunDecl decl;
    /**
     * The structured body.
     */
    @NotNull
    public Expression body;

    /**
     * Construct a new CfimPassesEvent.
     *
     * @param decl The declaration.
     * @param body The structured body.
     */
    public CfimPassesEvent(@NotNull FunDecl decl, @NotNull Expression body) {
        this.decl = decl;
        this.body = body;
    }
}
