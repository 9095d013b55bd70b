package io.github.eutro.funclets.ops;

import io.github.eutro.funclets.ssa.Insn;
import io.github.eutro.funclets.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if any.
 */
public class Op {
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    public Insn insn(Var... args) {
        return new Insn(this, args);
    }

    public Insn insn(List<Var> args) {
        return new Insn(this, args);
    }
}
