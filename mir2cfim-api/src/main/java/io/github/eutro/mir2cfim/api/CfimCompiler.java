package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.api.events.CompilerEvent;
import io.github.eutro.mir2cfim.api.events.CrateCompileEvent;
import io.github.eutro.mir2cfim.api.events.EmitDeclarationEvent;
import io.github.eutro.mir2cfim.api.events.EventDispatcher;
import io.github.eutro.mir2cfim.api.events.EventSupplier;
import io.github.eutro.mir2cfim.api.events.RunCrateCompilationEvent;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Structures the declarations of crates.
 * <p>
 * Listeners added to the compiler apply to every compilation submitted to it.
 */
public class CfimCompiler extends EventSupplier<CompilerEvent> {
    @NotNull
    private final StructuringOptions options;

    /**
     * Construct a compiler with the {@link StructuringOptions#DEFAULT default options}.
     */
    public CfimCompiler() {
        this(StructuringOptions.DEFAULT);
    }

    /**
     * Construct a compiler with the given options.
     *
     * @param options The options.
     */
    public CfimCompiler(@NotNull StructuringOptions options) {
        this.options = options;
    }

    @NotNull
    public StructuringOptions getOptions() {
        return options;
    }

    /**
     * Submit the declarations of a crate for structuring. Nothing happens until {@link CrateCompilation#run()}.
     *
     * @param decls The declarations, in the order they should be emitted.
     * @return The compilation.
     */
    @Contract(pure = true)
    @NotNull
    public CrateCompilation submit(@NotNull Collection<io.github.eutro.mir2cfim.core.im.FunDecl> decls) {
        return new CrateCompilation(this, new ArrayList<>(decls));
    }

    @Contract(pure = true)
    @NotNull
    public CrateCompilation submit(io.github.eutro.mir2cfim.core.im.FunDecl... decls) {
        return submit(Arrays.asList(decls));
    }

    /**
     * Get a dispatcher which listens to events on every compilation run by this compiler.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<CrateCompileEvent> lift() {
        return new EventDispatcher<CrateCompileEvent>() {
            @Override
            public <T extends CrateCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                CfimCompiler.this.listen(RunCrateCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect every declaration emitted by this compiler into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<FunDecl> outputsAsQueue() {
        BlockingQueue<FunDecl> queue = new LinkedBlockingQueue<>();
        lift().listen(EmitDeclarationEvent.class, evt -> queue.add(evt.decl));
        return queue;
    }
}
