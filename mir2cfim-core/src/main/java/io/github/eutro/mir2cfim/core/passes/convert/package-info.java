/**
 * Passes that convert the IR from one form to another.
 */
package io.github.eutro.mir2cfim.core.passes.convert;
