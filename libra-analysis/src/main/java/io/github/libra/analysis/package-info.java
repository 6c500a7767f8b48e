/**
 * Concrete data-flow analyses over the IR, each run with {@link io.github.libra.core.flow.FixedPoint}.
 */
package io.github.libra.analysis;
