package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CrateCompilation;

/**
 * An event fired during the compilation of a crate.
 *
 * @see CrateCompilation
 */
public interface CrateCompileEvent {
}
