/**
 * Events that occur during a compilation.
 * <p>
 * These can be used to inspect or replace bodies before and after structuring,
 * to drop declarations from the output, and to collect failures.
 * <p>
 * The API revolves around {@link io.github.eutro.mir2cfim.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.mir2cfim.api.events;
