/**
 * Passes that simplify structured bodies without changing what they do.
 */
package io.github.eutro.mir2cfim.core.passes.opts;
