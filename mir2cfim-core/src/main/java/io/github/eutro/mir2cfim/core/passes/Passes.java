package io.github.eutro.mir2cfim.core.passes;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.FunDecl;
import io.github.eutro.mir2cfim.core.passes.convert.ImToCfim;
import io.github.eutro.mir2cfim.core.passes.misc.ForPass;
import io.github.eutro.mir2cfim.core.passes.opts.ReconstructAsserts;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Structure a body, and reconstruct its assertions.
     */
    public static final IRPass<BlockGraph, Expression> STRUCTURE =
            ImToCfim.INSTANCE
                    .then(ReconstructAsserts.INSTANCE);

    /**
     * Structure a whole declaration, and reconstruct its assertions.
     */
    public static final IRPass<FunDecl, io.github.eutro.mir2cfim.core.cfim.FunDecl> STRUCTURE_DECL =
            ForPass.liftBodies(STRUCTURE);
}
