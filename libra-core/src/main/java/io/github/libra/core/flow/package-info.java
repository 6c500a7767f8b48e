/**
 * The worklist fixed-point engine, {@link io.github.libra.core.flow.FixedPoint}, and the states it computes.
 */
package io.github.libra.core.flow;
