/**
 * A configurable API over the core structuring passes.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.mir2cfim.api.CfimCompiler},
 * to which the declarations of a crate can be submitted for structuring.
 * <p>
 * The compiler is configured with {@link io.github.eutro.mir2cfim.api.StructuringOptions},
 * and can be extended using the {@link io.github.eutro.mir2cfim.api.events events API}.
 */
package io.github.eutro.mir2cfim.api;
