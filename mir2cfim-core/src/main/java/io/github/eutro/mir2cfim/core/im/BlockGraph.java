package io.github.eutro.mir2cfim.core.im;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The body of a function before its control flow is reconstructed: an entry block and
 * a mapping from block ids to blocks.
 * <p>
 * A built graph is immutable, and every jump target it mentions exists in it.
 */
public final class BlockGraph {
    private final BlockId entry;
    private final Map<BlockId, Block> blocks;

    private BlockGraph(BlockId entry, Map<BlockId, Block> blocks) {
        this.entry = entry;
        this.blocks = Collections.unmodifiableMap(blocks);
    }

    /**
     * Create a new builder.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    public BlockId getEntry() {
        return entry;
    }

    /**
     * Get a block of this graph.
     *
     * @param id The id of the block.
     * @return The block.
     * @throws IllegalArgumentException If there is no such block.
     */
    public Block get(BlockId id) {
        Block block = blocks.get(id);
        if (block == null) throw new IllegalArgumentException("no block " + id + " in graph");
        return block;
    }

    /**
     * Get the successors of a block, in the order of its {@link Terminator#getTargets() terminator's targets}.
     *
     * @param id The id of the block.
     * @return The successors, possibly with duplicates.
     */
    public List<BlockId> successors(BlockId id) {
        return get(id).getTerminator().getTargets();
    }

    /**
     * Get all the blocks in this graph, in the order they were added to the builder.
     *
     * @return The blocks.
     */
    public Collection<Block> getBlocks() {
        return blocks.values();
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("entry: ").append(entry);
        for (Block block : blocks.values()) {
            sb.append('\n').append(block);
        }
        return sb.toString();
    }

    /**
     * A builder for block graphs. The first block added is the entry, unless {@link #setEntry(BlockId)} is called.
     */
    public static final class Builder {
        private final Map<BlockId, Block> blocks = new LinkedHashMap<>();
        private BlockId entry;

        private Builder() {
        }

        /**
         * Set the entry block.
         *
         * @param entry The entry block.
         * @return This, for convenience.
         */
        public Builder setEntry(@NotNull BlockId entry) {
            this.entry = entry;
            return this;
        }

        /**
         * Add a block.
         *
         * @param block The block.
         * @return This, for convenience.
         * @throws IllegalArgumentException If a block with the same id was already added.
         */
        public Builder add(@NotNull Block block) {
            if (blocks.putIfAbsent(block.getId(), block) != null) {
                throw new IllegalArgumentException("duplicate block " + block.getId());
            }
            if (entry == null) entry = block.getId();
            return this;
        }

        /**
         * Add a block.
         *
         * @param index      The index of the block's id.
         * @param terminator The terminator of the block.
         * @param statements The statements of the block.
         * @return This, for convenience.
         */
        public Builder add(int index, @NotNull Terminator terminator, Statement... statements) {
            return add(new Block(BlockId.of(index), Arrays.asList(statements), terminator));
        }

        /**
         * Build the graph, checking that it is well-formed.
         *
         * @return The graph.
         * @throws IllegalStateException If the entry is missing, a jump target does not exist,
         *                               or a {@link Terminator.Nop nop terminator} is misplaced.
         */
        public BlockGraph build() {
            if (entry == null || !blocks.containsKey(entry)) {
                throw new IllegalStateException("missing entry block " + entry);
            }
            List<BlockId> jumpedTo = new ArrayList<>();
            for (Block block : blocks.values()) {
                for (BlockId target : block.getTerminator().getTargets()) {
                    if (!blocks.containsKey(target)) {
                        throw new IllegalStateException(block.getId() + " jumps to missing block " + target);
                    }
                    jumpedTo.add(target);
                }
                if (block.getTerminator() instanceof Terminator.Nop && !block.getId().equals(entry)) {
                    throw new IllegalStateException("nop terminator in non-entry block " + block.getId());
                }
            }
            if (blocks.get(entry).getTerminator() instanceof Terminator.Nop && jumpedTo.contains(entry)) {
                throw new IllegalStateException("nop-terminated entry block " + entry + " is jumped to");
            }
            return new BlockGraph(Objects.requireNonNull(entry), new LinkedHashMap<>(blocks));
        }
    }
}
