package io.github.eutro.mir2cfim.core.values;


import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A place in memory: a local variable followed by a (possibly empty) projection.
 * <p>
 * Places are produced by the lowering step and only moved around by the structuring passes,
 * so the projection elements are kept as already-rendered text.
 */
public final class Place {
    private final int varId;
    private final List<String> projection;

    private Place(int varId, List<String> projection) {
        this.varId = varId;
        this.projection = projection;
    }

    /**
     * Create a place.
     *
     * @param varId      The index of the local variable.
     * @param projection The projection elements, such as {@code "deref"} or {@code ".0"}.
     * @return The place.
     */
    public static Place of(int varId, String... projection) {
        if (varId < 0) throw new IllegalArgumentException("negative variable index " + varId);
        return new Place(varId, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(projection))));
    }

    public int getVarId() {
        return varId;
    }

    public List<String> getProjection() {
        return projection;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Place place = (Place) o;
        return varId == place.varId && projection.equals(place.projection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(varId, projection);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('_').append(varId);
        for (String elem : projection) {
            if (elem.equals("deref")) {
                sb.insert(0, '*');
            } else {
                sb.append(elem);
            }
        }
        return sb.toString();
    }
}
