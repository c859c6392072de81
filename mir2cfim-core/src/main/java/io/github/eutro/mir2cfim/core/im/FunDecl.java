package io.github.eutro.mir2cfim.core.im;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A function declaration whose body is still a {@link BlockGraph}.
 */
public final class FunDecl {
    /**
     * The id of the declaration, unique within a crate.
     */
    public final int defId;
    /**
     * The name of the declaration, used for diagnostics.
     */
    @NotNull
    public final String name;
    public final int argCount;
    @NotNull
    public final BlockGraph body;

    /**
     * Construct a function declaration.
     *
     * @param defId    The id of the declaration.
     * @param name     The name of the declaration.
     * @param argCount The number of arguments.
     * @param body     The body.
     */
    public FunDecl(int defId, @NotNull String name, int argCount, @NotNull BlockGraph body) {
        this.defId = defId;
        this.name = Objects.requireNonNull(name);
        this.argCount = argCount;
        this.body = Objects.requireNonNull(body);
    }

    /**
     * Copy this declaration with a different body.
     *
     * @param body The new body.
     * @return The new declaration.
     */
    public FunDecl withBody(@NotNull BlockGraph body) {
        return new FunDecl(defId, name, argCount, body);
    }

    @Override
    public String toString() {
        return "fn " + name + " (@Fun" + defId + ")\n" + body;
    }
}
