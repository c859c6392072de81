package io.github.eutro.mir2cfim.core.passes.misc;

import io.github.eutro.mir2cfim.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * Nested chains are flattened when the chain is built, so a failure can name the position
 * of the failing pass in the whole chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> passes;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<Object, Object>> passes = new ArrayList<>();
        flatten(firstPass, passes);
        flatten(nextPass, passes);
        this.passes = Collections.unmodifiableList(passes);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(IRPass<?, ?> pass, List<IRPass<Object, Object>> into) {
        if (pass instanceof ChainedPass) {
            into.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            into.add((IRPass<Object, Object>) pass);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error t) {
                t.addSuppressed(new RuntimeException("running pass " + i
                        + " (" + pass.getClass().getSimpleName() + ") in chain"));
                throw t;
            }
        }
        return (C) acc;
    }
}
