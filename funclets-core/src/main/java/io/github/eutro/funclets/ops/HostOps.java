package io.github.eutro.funclets.ops;

import io.github.eutro.funclets.bytecode.NumericOps;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Control;
import io.github.eutro.funclets.ssa.Var;

import java.util.List;

/**
 * Operations of the host bytecode.
 */
public class HostOps {
    // the last target of a branch is the fallthrough, the others are taken conditionally
    public static final Op BR_IF = new SimpleOpKey("br_if").create();
    public static final Op BR_TABLE = new SimpleOpKey("br_table").create();

    public static final UnaryOpKey<Integer> CALL = new UnaryOpKey<>("call", idx -> "func=" + idx);
    public static final UnaryOpKey<Integer> GLOBAL_GET = new UnaryOpKey<>("global.get");
    public static final UnaryOpKey<Integer> GLOBAL_SET = new UnaryOpKey<>("global.set");

    public static final UnaryOpKey<ValType> ZEROINIT = new UnaryOpKey<>("zeroinit");

    public static final Op SELECT = new SimpleOpKey("select").create(); /* cond ift iff */

    public static final UnaryOpKey<NumericOps.NumericOp> OPERATOR = new UnaryOpKey<>("op", op -> op.name);

    public static Control brIf(Var cond, BasicBlock thenB, BasicBlock elseB) {
        return BR_IF.insn(cond).jumpsTo(thenB, elseB);
    }

    /**
     * A table dispatch, jumping to {@code targets.get(cond)}, or the last target if out of range.
     *
     * @param cond    The index.
     * @param targets The targets, with the default last.
     * @return The control instruction.
     */
    public static Control brTable(Var cond, List<BasicBlock> targets) {
        return BR_TABLE.insn(cond).jumpsTo(targets);
    }
}
