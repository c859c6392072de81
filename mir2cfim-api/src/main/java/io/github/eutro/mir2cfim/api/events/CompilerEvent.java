package io.github.eutro.mir2cfim.api.events;

import io.github.eutro.mir2cfim.api.CfimCompiler;

/**
 * An event fired on a {@link CfimCompiler}.
 */
public interface CompilerEvent {
}
