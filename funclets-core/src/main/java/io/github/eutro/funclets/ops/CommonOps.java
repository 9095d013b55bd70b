package io.github.eutro.funclets.ops;

import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Control;
import io.github.eutro.funclets.ssa.Insn;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations that are independent of the bytecode being decoded.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its only target.
     * <p>
     * Funclet calls are lowered to this, since a tail call within a region is just a jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: returns its arguments from the function.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: traps with the given message; has no targets.
     */
    public static final UnaryOpKey<String> TRAP = new UnaryOpKey<>("trap");

    /**
     * Effect: selects the argument corresponding to the predecessor control arrived from.
     * <p>
     * The immediate lists the predecessors, in the same order as the arguments.
     * Phis precede all other effects of their block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));

    /**
     * Effect: the {@code n}th parameter of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg");
    /**
     * Effect: a constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");
    /**
     * Effect: a value that is never observed, produced for reads in blocks no control reaches.
     */
    public static final Op UNDEF = new SimpleOpKey("undef").create();

    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }

    public static Control br(BasicBlock target) {
        return BR.insn().jumpsTo(target);
    }

    public static Control trap(String message) {
        return TRAP.create(message).insn().jumpsTo();
    }
}
