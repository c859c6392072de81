package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CfimCompiler;
import io.github.eutro.mir2cfim.api.CrateCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a crate compilation is started, before any declaration is structured.
 * <p>
 * Listeners may register listeners on the compilation itself.
 *
 * @see CfimCompiler
 * @see CrateCompilation
 */
public class RunCrateCompilationEvent implements CompilerEvent {
    /**
     * The crate compilation.
     */
    @NotNull
    public final CrateCompilation compilation;

    /**
     * Construct a new crate compilation event.
     *
     * @param compilation The compilation.
     */
    public RunCrateCompilationEvent(@NotNull CrateCompilation compilation) {
        this.compilation = compilation;
    }
}
