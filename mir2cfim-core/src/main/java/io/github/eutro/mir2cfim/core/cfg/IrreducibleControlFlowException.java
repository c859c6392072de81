package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a {@link io.github.eutro.mir2cfim.core.im.BlockGraph block graph} has a cycle
 * that can be entered other than through a single header block, so its control flow
 * cannot be expressed with nested loops.
 */
public class IrreducibleControlFlowException extends RuntimeException {
    private final BlockId offendingBlock;

    /**
     * Construct an irreducible control flow exception.
     *
     * @param offendingBlock A block of the cycle that has more than one entry.
     */
    public IrreducibleControlFlowException(@NotNull BlockId offendingBlock) {
        super("irreducible control flow at " + offendingBlock);
        this.offendingBlock = offendingBlock;
    }

    /**
     * Get the block of the offending cycle where the problem was detected.
     *
     * @return The block.
     */
    @NotNull
    public BlockId getOffendingBlock() {
        return offendingBlock;
    }
}
