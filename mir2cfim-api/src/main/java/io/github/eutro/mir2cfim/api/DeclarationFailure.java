package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.core.cfg.IrreducibleControlFlowException;
import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown, or collected in the {@link CompilationResult}, when the control flow of a declaration
 * cannot be reconstructed.
 */
public class DeclarationFailure extends RuntimeException {
    private final int defId;
    private final String declName;
    private final BlockId offendingBlock;

    /**
     * Construct a declaration failure.
     *
     * @param defId    The id of the declaration.
     * @param declName The name of the declaration.
     * @param cause    Why its control flow could not be reconstructed.
     */
    public DeclarationFailure(int defId, @NotNull String declName, @NotNull IrreducibleControlFlowException cause) {
        super("could not reconstruct control flow for declaration " + declName + ": " + cause.getMessage(), cause);
        this.defId = defId;
        this.declName = declName;
        this.offendingBlock = cause.getOffendingBlock();
    }

    public int getDefId() {
        return defId;
    }

    @NotNull
    public String getDeclName() {
        return declName;
    }

    /**
     * Get the block at which irreducible control flow was detected.
     *
     * @return The block.
     */
    @NotNull
    public BlockId getOffendingBlock() {
        return offendingBlock;
    }
}
