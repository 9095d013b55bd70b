package io.github.eutro.funclets.passes;

import io.github.eutro.funclets.ssa.Function;

/**
 * A pass to run on some part of the IR (e.g. a {@link Function}),
 * which may modify the IR, or convert it to a different form.
 * <p>
 * A pass may be <i>in-place</i>, in which case it must have the same
 * input and result types, and should return true for {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    B run(A a);

    default boolean isInPlace() {
        return false;
    }
}
