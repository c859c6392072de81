package io.github.eutro.mir2cfim.core.values;

/**
 * Functions from the standard library which are given primitive semantics instead of being translated.
 */
public enum AssumedFunId {
    BOX_NEW("alloc::boxed::Box%s::new"),
    BOX_DEREF("core::ops::deref::Deref<Box%s>::deref"),
    BOX_DEREF_MUT("core::ops::deref::DerefMut<Box%s>::deref_mut"),
    BOX_FREE("alloc::alloc::box_free%s"),
    ;

    private final String pathFormat;

    AssumedFunId(String pathFormat) {
        this.pathFormat = pathFormat;
    }

    /**
     * Format the path of this function, with the given generic arguments already rendered.
     *
     * @param params The generic arguments, e.g. {@code "<u32>"}, or an empty string.
     * @return The path.
     */
    public String formatPath(String params) {
        return String.format(pathFormat, params);
    }
}
