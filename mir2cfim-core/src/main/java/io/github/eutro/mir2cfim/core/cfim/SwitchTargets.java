package io.github.eutro.mir2cfim.core.cfim;

import io.github.eutro.mir2cfim.core.values.IntegerTy;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The branches of a {@link Expression.Switch}.
 */
public abstract class SwitchTargets {
    private SwitchTargets() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitIf(If targets);

        R visitSwitchInt(SwitchInt targets);
    }

    public static If ifThenElse(@NotNull Expression thenExpr, @NotNull Expression elseExpr) {
        return new If(thenExpr, elseExpr);
    }

    /**
     * Create integer switch targets.
     *
     * @param ty        The type of the scrutinee.
     * @param branches  The branches, in the order they were declared.
     * @param otherwise The default branch.
     * @return The targets.
     */
    public static SwitchInt switchInt(
            @NotNull IntegerTy ty,
            @NotNull Map<ScalarValue, Expression> branches,
            @NotNull Expression otherwise
    ) {
        return new SwitchInt(ty, new LinkedHashMap<>(branches), otherwise);
    }

    /**
     * A boolean test: the {@link #thenExpr} runs if the scrutinee is true, the {@link #elseExpr} otherwise.
     */
    public static final class If extends SwitchTargets {
        public final Expression thenExpr;
        public final Expression elseExpr;

        If(Expression thenExpr, Expression elseExpr) {
            this.thenExpr = Objects.requireNonNull(thenExpr);
            this.elseExpr = Objects.requireNonNull(elseExpr);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof If)) return false;
            If that = (If) o;
            return thenExpr.equals(that.thenExpr) && elseExpr.equals(that.elseExpr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(thenExpr, elseExpr);
        }
    }

    /**
     * An integer switch. Branches keep their declared order; the default always comes last.
     */
    public static final class SwitchInt extends SwitchTargets {
        public final IntegerTy ty;
        public final Map<ScalarValue, Expression> branches;
        public final Expression otherwise;

        SwitchInt(IntegerTy ty, LinkedHashMap<ScalarValue, Expression> branches, Expression otherwise) {
            this.ty = Objects.requireNonNull(ty);
            this.branches = Collections.unmodifiableMap(branches);
            this.otherwise = Objects.requireNonNull(otherwise);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitchInt(this);
        }

        /**
         * Compares branch order as well as contents.
         */
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SwitchInt)) return false;
            SwitchInt that = (SwitchInt) o;
            return ty == that.ty
                    && otherwise.equals(that.otherwise)
                    && new ArrayList<>(branches.entrySet()).equals(new ArrayList<>(that.branches.entrySet()));
        }

        @Override
        public int hashCode() {
            return Objects.hash(ty, branches, otherwise);
        }
    }
}
