/**
 * Exception types surfaced by the engine.
 *
 * <p>
 * Input and parameter problems are {@link java.lang.IllegalArgumentException}
 * subclasses and are raised before any work starts. Numerically degenerate
 * segments and under-sized Monte Carlo runs are <strong>not</strong> errors;
 * they are reported as flags and warnings on the returned results.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.error;
