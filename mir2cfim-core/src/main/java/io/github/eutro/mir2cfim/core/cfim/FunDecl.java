package io.github.eutro.mir2cfim.core.cfim;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A function declaration whose body has been structured.
 */
public final class FunDecl {
    public final int defId;
    @NotNull
    public final String name;
    public final int argCount;
    /**
     * Whether the function might diverge: it contains loops, is recursive,
     * or calls a function which might diverge.
     */
    public final boolean divergent;
    @NotNull
    public final Expression body;

    /**
     * Construct a structured function declaration.
     *
     * @param defId     The id of the declaration.
     * @param name      The name of the declaration.
     * @param argCount  The number of arguments.
     * @param divergent Whether the function might diverge.
     * @param body      The structured body.
     */
    public FunDecl(int defId, @NotNull String name, int argCount, boolean divergent, @NotNull Expression body) {
        this.defId = defId;
        this.name = Objects.requireNonNull(name);
        this.argCount = argCount;
        this.divergent = divergent;
        this.body = Objects.requireNonNull(body);
    }

    public FunDecl withDivergent(boolean divergent) {
        return new FunDecl(defId, name, argCount, divergent, body);
    }

    public FunDecl withBody(@NotNull Expression body) {
        return new FunDecl(defId, name, argCount, divergent, body);
    }

    @Override
    public String toString() {
        return (divergent ? "divergent " : "") + "fn " + name + " {\n"
                + new CfimFormatter("    ").format(body).replaceAll("(?m)^", "    ")
                + "\n}";
    }
}
