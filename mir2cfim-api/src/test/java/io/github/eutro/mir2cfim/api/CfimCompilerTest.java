package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.api.events.CfimPassesEvent;
import io.github.eutro.mir2cfim.api.events.DeclarationFailedEvent;
import io.github.eutro.mir2cfim.api.events.EmitDeclarationEvent;
import io.github.eutro.mir2cfim.api.events.ImPassesEvent;
import io.github.eutro.mir2cfim.api.events.RunCrateCompilationEvent;
import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import io.github.eutro.mir2cfim.core.cfim.Statement;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.values.AssumedFunId;
import io.github.eutro.mir2cfim.core.values.FunId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.eutro.mir2cfim.api.Decls.*;
import static org.junit.jupiter.api.Assertions.*;

public class CfimCompilerTest {
    private static List<String> names(List<FunDecl> decls) {
        List<String> names = new ArrayList<>();
        for (FunDecl decl : decls) {
            names.add(decl.name);
        }
        return names;
    }

    @Test
    void testCompileCrate() {
        CompilationResult result = new CfimCompiler().submit(
                check(0, "check"),
                spin(1, "spin"),
                calls(2, "caller", FunId.local(1)),
                calls(3, "checked", FunId.local(0), FunId.assumed(AssumedFunId.BOX_NEW))
        ).run();

        assertTrue(result.isSuccessful());
        assertEquals(Arrays.asList("check", "spin", "caller", "checked"), names(result.getDeclarations()));
        assertFalse(result.getDeclaration("check").divergent);
        assertTrue(result.getDeclaration("spin").divergent);
        assertTrue(result.getDeclaration("caller").divergent);
        assertFalse(result.getDeclaration("checked").divergent);
        assertEquals(Expression.seq(
                Expression.leaf(Statement.assertThat(cond(0), false)),
                Expression.leaf(Statement.ret())
        ), result.getDeclaration("check").body);
        assertNull(result.getDeclaration("missing"));
    }

    @Test
    void testWithoutAsserts() {
        CfimCompiler cc = new CfimCompiler(StructuringOptions.builder().setReconstructAsserts(false).build());
        FunDecl check = cc.submit(check(0, "check")).run().getDeclaration("check");
        assertNotNull(check);
        assertTrue(check.body instanceof Expression.Sequence);
        assertTrue(((Expression.Sequence) check.body).first instanceof Expression.Switch);
    }

    @Test
    void testFailuresCollected() {
        AtomicInteger failed = new AtomicInteger();
        CfimCompiler cc = new CfimCompiler();
        cc.lift().listen(DeclarationFailedEvent.class, evt -> failed.incrementAndGet());
        CompilationResult result = cc.submit(
                check(0, "check"),
                irreducible(5, "tangle"),
                spin(1, "spin")
        ).run();

        assertFalse(result.isSuccessful());
        assertEquals(Arrays.asList("check", "spin"), names(result.getDeclarations()));
        assertEquals(1, result.getFailures().size());
        DeclarationFailure failure = result.getFailures().get(0);
        assertEquals(5, failure.getDefId());
        assertEquals("tangle", failure.getDeclName());
        assertEquals(bb(1), failure.getOffendingBlock());
        assertEquals("could not reconstruct control flow for declaration tangle: irreducible control flow at bb1",
                failure.getMessage());
        assertEquals(1, failed.get());
    }

    @Test
    void testFailFast() {
        CfimCompiler cc = new CfimCompiler(StructuringOptions.builder().setFailFast(true).build());
        BlockingQueue<FunDecl> emitted = cc.outputsAsQueue();
        CrateCompilation compilation = cc.submit(check(0, "check"), irreducible(1, "tangle"));
        DeclarationFailure failure = assertThrows(DeclarationFailure.class, compilation::run);
        assertEquals("tangle", failure.getDeclName());
        assertTrue(emitted.isEmpty());
    }

    @Test
    void testParallelMatchesSequential() {
        List<io.github.eutro.mir2cfim.core.im.FunDecl> decls = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            switch (i % 4) {
                case 0:
                    decls.add(check(i, "f" + i));
                    break;
                case 1:
                    decls.add(spin(i, "f" + i));
                    break;
                case 2:
                    decls.add(calls(i, "f" + i, FunId.local(i - 1), FunId.local((i + 2) % 40)));
                    break;
                default:
                    decls.add(irreducible(i, "f" + i));
            }
        }
        CompilationResult sequential = new CfimCompiler().submit(decls).run();
        CompilationResult parallel = new CfimCompiler(StructuringOptions.builder().setParallelism(4).build())
                .submit(decls).run();

        assertEquals(names(sequential.getDeclarations()), names(parallel.getDeclarations()));
        for (int i = 0; i < sequential.getDeclarations().size(); i++) {
            FunDecl s = sequential.getDeclarations().get(i);
            FunDecl p = parallel.getDeclarations().get(i);
            assertEquals(s.body, p.body);
            assertEquals(s.divergent, p.divergent);
        }
        assertEquals(10, parallel.getFailures().size());
        for (int i = 0; i < 10; i++) {
            assertEquals(sequential.getFailures().get(i).getMessage(), parallel.getFailures().get(i).getMessage());
        }
    }

    @Test
    void testParallelFailFast() {
        CfimCompiler cc = new CfimCompiler(StructuringOptions.builder()
                .setParallelism(2)
                .setFailFast(true)
                .build());
        assertThrows(DeclarationFailure.class, () -> cc.submit(
                spin(0, "spin"),
                irreducible(1, "tangle"),
                check(2, "check")
        ).run());
    }

    @Test
    void testEvents() {
        CfimCompiler cc = new CfimCompiler();
        List<String> seen = new CopyOnWriteArrayList<>();
        cc.listen(RunCrateCompilationEvent.class, evt -> seen.add("run " + evt.compilation.decls.size()));
        cc.lift().listen(ImPassesEvent.class, evt -> {
            if (evt.decl.name.equals("spin")) {
                evt.graph = BlockGraph.builder().add(0, Terminator.ret()).build();
            }
        });
        cc.lift().listen(CfimPassesEvent.class, evt -> seen.add("structured " + evt.decl.name));
        cc.lift().listen(EmitDeclarationEvent.class, evt -> {
            if (evt.decl.name.equals("check")) evt.cancel();
        });
        BlockingQueue<FunDecl> emitted = cc.outputsAsQueue();

        CrateCompilation compilation = cc.submit(check(0, "check"), spin(1, "spin"));
        compilation.listen(EmitDeclarationEvent.class, evt -> seen.add("emit " + evt.decl.name));
        CompilationResult result = compilation.run();

        // listeners on the compilation itself precede the lifted ones, so they see the cancelled declaration too
        assertEquals(Arrays.asList("run 2", "structured check", "structured spin", "emit check", "emit spin"), seen);
        assertEquals(Arrays.asList("spin"), names(result.getDeclarations()));
        FunDecl spin = result.getDeclaration("spin");
        assertNotNull(spin);
        assertFalse(spin.divergent);
        assertEquals(Expression.leaf(Statement.ret()), spin.body);
        assertEquals(1, emitted.size());
        assertSame(spin, emitted.peek());
    }

    @Test
    void testVetoHidesLaterHooks() {
        List<String> seen = new CopyOnWriteArrayList<>();
        CrateCompilation compilation = new CfimCompiler().submit(check(0, "check"), spin(1, "spin"));
        compilation.listen(EmitDeclarationEvent.class, evt -> {
            if (evt.decl.name.equals("check")) evt.cancel();
        });
        compilation.listen(EmitDeclarationEvent.class, evt -> seen.add("emit " + evt.decl.name));
        CompilationResult result = compilation.run();

        assertEquals(Arrays.asList("emit spin"), seen);
        assertEquals(Arrays.asList("spin"), names(result.getDeclarations()));
    }

    @Test
    void testOptions() {
        StructuringOptions options = StructuringOptions.DEFAULT;
        assertTrue(options.shouldReconstructAsserts());
        assertEquals(1, options.getParallelism());
        assertFalse(options.isFailFast());
        assertThrows(IllegalArgumentException.class, () -> StructuringOptions.builder().setParallelism(0));

        StructuringOptions changed = options.toBuilder().setParallelism(3).build();
        assertEquals(3, changed.getParallelism());
        assertTrue(changed.shouldReconstructAsserts());
        assertSame(changed, new CfimCompiler(changed).getOptions());
    }
}
