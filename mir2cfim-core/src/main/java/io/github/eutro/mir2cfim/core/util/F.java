package io.github.eutro.mir2cfim.core.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, kept separate so that passes can
 * take successor functions without dragging in the rest of that interface.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    /**
     * Apply the function.
     *
     * @param a The argument.
     * @return The result.
     */
    B apply(A a);
}
