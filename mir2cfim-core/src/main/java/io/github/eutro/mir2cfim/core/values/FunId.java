package io.github.eutro.mir2cfim.core.values;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The callee of a call: either a declaration of the crate being extracted, or an {@link AssumedFunId assumed} function.
 */
public final class FunId {
    private final int defId;
    @Nullable
    private final AssumedFunId assumed;

    private FunId(int defId, @Nullable AssumedFunId assumed) {
        this.defId = defId;
        this.assumed = assumed;
    }

    /**
     * Refer to a local declaration.
     *
     * @param defId The id of the declaration.
     * @return The function id.
     */
    public static FunId local(int defId) {
        if (defId < 0) throw new IllegalArgumentException("negative declaration id " + defId);
        return new FunId(defId, null);
    }

    /**
     * Refer to an assumed function.
     *
     * @param assumed The function.
     * @return The function id.
     */
    public static FunId assumed(@NotNull AssumedFunId assumed) {
        return new FunId(-1, assumed);
    }

    public boolean isLocal() {
        return assumed == null;
    }

    /**
     * Get the id of the local declaration this refers to.
     *
     * @return The declaration id.
     * @throws IllegalStateException If this is an assumed function.
     */
    public int getDefId() {
        if (assumed != null) throw new IllegalStateException(assumed + " is not a local function");
        return defId;
    }

    @Nullable
    public AssumedFunId getAssumed() {
        return assumed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunId funId = (FunId) o;
        return defId == funId.defId && assumed == funId.assumed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(defId, assumed);
    }

    @Override
    public String toString() {
        return assumed == null ? "@Fun" + defId : assumed.formatPath("");
    }
}
