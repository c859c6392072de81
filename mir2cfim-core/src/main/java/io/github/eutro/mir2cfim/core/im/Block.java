package io.github.eutro.mir2cfim.core.im;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A basic block, encapsulating a list of {@link Statement statements},
 * followed by exactly one {@link Terminator} at the end.
 */
public final class Block {
    private final BlockId id;
    private final List<Statement> statements;
    private final Terminator terminator;

    /**
     * Construct a block.
     *
     * @param id         The id of the block.
     * @param statements The statements of the block, which are copied.
     * @param terminator The terminator.
     */
    public Block(@NotNull BlockId id, @NotNull List<Statement> statements, @NotNull Terminator terminator) {
        this.id = Objects.requireNonNull(id);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.terminator = Objects.requireNonNull(terminator);
    }

    public BlockId getId() {
        return id;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(id).append(" {\n");
        for (Statement statement : statements) {
            sb.append("  ").append(statement).append(";\n");
        }
        sb.append("  ").append(terminator).append(";\n}");
        return sb.toString();
    }
}
