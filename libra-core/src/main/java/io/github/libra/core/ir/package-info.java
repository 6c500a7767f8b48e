/**
 * The validated internal representation the analyses run on.
 * <p>
 * A {@link io.github.libra.core.ir.Module} holds {@link io.github.libra.core.ir.GlobalVariable}s
 * and {@link io.github.libra.core.ir.Function}s. The body of a defined function is a
 * {@link io.github.libra.core.ir.ControlFlowGraph} of {@link io.github.libra.core.ir.Block}s,
 * each a list of {@link io.github.libra.core.ir.Instruction}s ended by a single
 * {@link io.github.libra.core.ir.Terminator}.
 * <p>
 * Instructions write their result to a {@link io.github.libra.core.ir.RegisterSlot}, numbered
 * by the index of the instruction, and read {@link io.github.libra.core.ir.Value}s, which are
 * constants, function arguments, or registers.
 * <p>
 * Everything in this package is immutable once built; build it from the adapter IR with
 * {@link io.github.libra.core.passes.convert.AdapterToIr}.
 */
package io.github.libra.core.ir;
