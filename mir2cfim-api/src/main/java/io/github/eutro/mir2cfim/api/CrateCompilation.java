package io.github.eutro.mir2cfim.api;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.mir2cfim.api.events.CfimPassesEvent;
import io.github.eutro.mir2cfim.api.events.CrateCompileEvent;
import io.github.eutro.mir2cfim.api.events.DeclarationFailedEvent;
import io.github.eutro.mir2cfim.api.events.EmitDeclarationEvent;
import io.github.eutro.mir2cfim.api.events.EventSupplier;
import io.github.eutro.mir2cfim.api.events.ImPassesEvent;
import io.github.eutro.mir2cfim.api.events.RunCrateCompilationEvent;
import io.github.eutro.mir2cfim.core.cfg.IrreducibleControlFlowException;
import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Expressions;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.passes.IRPass;
import io.github.eutro.mir2cfim.core.passes.Passes;
import io.github.eutro.mir2cfim.core.passes.convert.ImToCfim;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Represents the compilation of the declarations of a single crate.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunCrateCompilationEvent} is fired on the {@link CfimCompiler compiler}.</li>
 *     <li>For each declaration, possibly on a worker thread:
 *     <ol>
 *         <li>{@link ImPassesEvent} is fired.</li>
 *         <li>The body is {@link ImToCfim structured}, and its asserts are
 *         {@link io.github.eutro.mir2cfim.core.passes.opts.ReconstructAsserts reconstructed}
 *         if the options say so.</li>
 *         <li>{@link CfimPassesEvent} is fired, or {@link DeclarationFailedEvent} if the body
 *         could not be structured.</li>
 *     </ol>
 *     </li>
 *     <li>{@link DivergenceAnalysis Divergence} is computed across the structured declarations.</li>
 *     <li>{@link EmitDeclarationEvent} is fired for each structured declaration, in submission order.</li>
 * </ol>
 */
public class CrateCompilation extends EventSupplier<CrateCompileEvent> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final CfimCompiler cc;

    /**
     * The declarations being compiled.
     */
    @NotNull
    public final List<io.github.eutro.mir2cfim.core.im.FunDecl> decls;

    /**
     * Construct a new crate compilation in the given compiler for the given declarations.
     *
     * @param cc    The compiler.
     * @param decls The declarations.
     */
    CrateCompilation(CfimCompiler cc, @NotNull List<io.github.eutro.mir2cfim.core.im.FunDecl> decls) {
        this.cc = cc;
        this.decls = Collections.unmodifiableList(decls);
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The structured declarations, and the declarations that could not be structured.
     * @throws DeclarationFailure If a declaration could not be structured,
     *                            and the compiler is {@link StructuringOptions#isFailFast() failing fast}.
     */
    public CompilationResult run() {
        cc.dispatch(RunCrateCompilationEvent.class, new RunCrateCompilationEvent(this));
        StructuringOptions options = cc.getOptions();
        IRPass<BlockGraph, Expression> pass = options.shouldReconstructAsserts()
                ? Passes.STRUCTURE
                : ImToCfim.INSTANCE;
        logger.atFine().log("structuring %d declaration(s) with %s", decls.size(), options);

        List<Outcome> outcomes = options.getParallelism() > 1 && decls.size() > 1
                ? structureParallel(pass, options)
                : structureSequential(pass, options);

        List<FunDecl> structured = new ArrayList<>();
        List<DeclarationFailure> failures = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.decl != null) {
                structured.add(outcome.decl);
            } else {
                failures.add(outcome.failure);
            }
        }

        Set<Integer> divergent = DivergenceAnalysis.divergent(structured);
        List<FunDecl> emitted = new ArrayList<>();
        for (FunDecl decl : structured) {
            EmitDeclarationEvent evt = dispatch(EmitDeclarationEvent.class,
                    new EmitDeclarationEvent(decl.withDivergent(divergent.contains(decl.defId))));
            if (evt.isCancelled()) {
                logger.atFine().log("emission of %s cancelled", decl.name);
            } else {
                emitted.add(evt.decl);
            }
        }
        return new CompilationResult(emitted, failures);
    }

    private List<Outcome> structureSequential(IRPass<BlockGraph, Expression> pass, StructuringOptions options) {
        List<Outcome> outcomes = new ArrayList<>();
        for (io.github.eutro.mir2cfim.core.im.FunDecl decl : decls) {
            outcomes.add(structure(pass, options, decl));
        }
        return outcomes;
    }

    private List<Outcome> structureParallel(IRPass<BlockGraph, Expression> pass, StructuringOptions options) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.getParallelism(), decls.size()));
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (io.github.eutro.mir2cfim.core.im.FunDecl decl : decls) {
                futures.add(executor.submit(() -> structure(pass, options, decl)));
            }
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while structuring", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome structure(
            IRPass<BlockGraph, Expression> pass,
            StructuringOptions options,
            io.github.eutro.mir2cfim.core.im.FunDecl decl
    ) {
        logger.atFine().log("structuring %s", decl.name);
        BlockGraph graph = dispatch(ImPassesEvent.class, new ImPassesEvent(decl, decl.body)).graph;
        Expression body;
        try {
            body = pass.run(graph);
        } catch (IrreducibleControlFlowException e) {
            DeclarationFailure failure = new DeclarationFailure(decl.defId, decl.name, e);
            logger.atWarning().log("%s", failure.getMessage());
            dispatch(DeclarationFailedEvent.class, new DeclarationFailedEvent(failure));
            if (options.isFailFast()) throw failure;
            return new Outcome(null, failure);
        }
        body = dispatch(CfimPassesEvent.class, new CfimPassesEvent(decl, body)).body;
        return new Outcome(new FunDecl(
                decl.defId,
                decl.name,
                decl.argCount,
                Expressions.containsLoop(body),
                body
        ), null);
    }

    private static class Outcome {
        @Nullable
        final FunDecl decl;
        @Nullable
        final DeclarationFailure failure;

        Outcome(@Nullable FunDecl decl, @Nullable DeclarationFailure failure) {
            this.decl = decl;
            this.failure = failure;
        }
    }
}
