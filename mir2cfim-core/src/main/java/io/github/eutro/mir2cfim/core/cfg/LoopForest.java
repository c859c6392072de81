package io.github.eutro.mir2cfim.core.cfg;

import io.github.eutro.mir2cfim.core.im.BlockId;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The loops of a reducible graph, which are either disjoint or properly nested.
 */
public final class LoopForest {
    private final Map<BlockId, Loop> byHeader;
    private final Map<BlockId, Loop> innermost = new HashMap<>();

    /**
     * Construct a loop forest, linking each loop to its parent.
     *
     * @param byHeader The loops, keyed by header, outer loops before the loops nested in them.
     */
    public LoopForest(LinkedHashMap<BlockId, Loop> byHeader) {
        this.byHeader = Collections.unmodifiableMap(byHeader);
        // outer loops come first, so later loops overwrite with something more nested
        for (Loop loop : byHeader.values()) {
            Loop parent = innermost.get(loop.getHeader());
            loop.setParent(parent);
            for (BlockId block : loop.getBody()) {
                innermost.put(block, loop);
            }
        }
    }

    /**
     * Get the loop with the given header.
     *
     * @param header The header.
     * @return The loop, or null if the block is not a loop header.
     */
    @Nullable
    public Loop loopAt(BlockId header) {
        return byHeader.get(header);
    }

    public boolean isHeader(BlockId block) {
        return byHeader.containsKey(block);
    }

    /**
     * Get the innermost loop containing a block.
     *
     * @param block The block.
     * @return The loop, or null if the block is in no loop.
     */
    @Nullable
    public Loop innermostLoopOf(BlockId block) {
        return innermost.get(block);
    }

    /**
     * Get all loops, outer loops before the loops nested in them.
     *
     * @return The loops.
     */
    public Collection<Loop> getLoops() {
        return byHeader.values();
    }

    @Override
    public String toString() {
        return byHeader.values().toString();
    }
}
