/**
 * The SSA IR: {@link io.github.eutro.funclets.ssa.Function}s made of
 * {@link io.github.eutro.funclets.ssa.BasicBlock}s, and the
 * {@link io.github.eutro.funclets.ssa.SsaBuilder} that constructs them on the fly.
 */
package io.github.eutro.funclets.ssa;
