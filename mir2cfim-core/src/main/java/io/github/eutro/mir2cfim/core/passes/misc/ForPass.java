package io.github.eutro.mir2cfim.core.passes.misc;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfim.Expressions;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.FunDecl;
import io.github.eutro.mir2cfim.core.passes.IRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift a structuring pass on bodies to operate on whole declarations.
     * <p>
     * The result is marked divergent if its body contains a loop; divergence through
     * calls needs the whole crate, and is left to the caller.
     *
     * @param pass The body pass.
     * @return The declaration pass.
     */
    public static IRPass<FunDecl, io.github.eutro.mir2cfim.core.cfim.FunDecl> liftBodies(IRPass<BlockGraph, Expression> pass) {
        return new Bodies(pass);
    }

    /**
     * Lift a pass on structured bodies to operate on whole structured declarations.
     *
     * @param pass The body pass.
     * @return The declaration pass.
     */
    public static IRPass<io.github.eutro.mir2cfim.core.cfim.FunDecl, io.github.eutro.mir2cfim.core.cfim.FunDecl>
    liftStructuredBodies(IRPass<Expression, Expression> pass) {
        return decl -> decl.withBody(pass.run(decl.body));
    }

    /**
     * Lift a pass to operate on every element of a list, in order.
     *
     * @param pass The pass.
     * @param <A>  The input type.
     * @param <B>  The result type.
     * @return The list pass.
     */
    public static <A, B> IRPass<List<A>, List<B>> liftList(IRPass<A, B> pass) {
        return as -> {
            List<B> bs = new ArrayList<>(as.size());
            for (A a : as) {
                bs.add(pass.run(a));
            }
            return bs;
        };
    }

    /**
     * A body structuring pass lifted to operate on declarations.
     */
    public static class Bodies implements IRPass<FunDecl, io.github.eutro.mir2cfim.core.cfim.FunDecl> {
        private final IRPass<BlockGraph, Expression> pass;

        private Bodies(IRPass<BlockGraph, Expression> pass) {
            this.pass = pass;
        }

        @Override
        public io.github.eutro.mir2cfim.core.cfim.FunDecl run(FunDecl decl) {
            Expression body = pass.run(decl.body);
            return new io.github.eutro.mir2cfim.core.cfim.FunDecl(
                    decl.defId,
                    decl.name,
                    decl.argCount,
                    Expressions.containsLoop(body),
                    body
            );
        }
    }
}
