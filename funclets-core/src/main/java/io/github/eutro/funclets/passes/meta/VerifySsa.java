package io.github.eutro.funclets.passes.meta;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtContainer;
import io.github.eutro.funclets.ops.CommonOps;
import io.github.eutro.funclets.passes.InPlaceIRPass;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Effect;
import io.github.eutro.funclets.ssa.Function;
import io.github.eutro.funclets.ssa.Var;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Checks the shape of finished SSA IR, throwing {@link IllegalStateException} on the first problem.
 * <ul>
 *     <li>every block has a control instruction;</li>
 *     <li>{@link CommonExts#PREDS} agrees with what {@link ComputePreds} computes;</li>
 *     <li>phis come first in their block, and have one operand per predecessor;</li>
 *     <li>no variable is assigned twice;</li>
 *     <li>the {@code OWNING_*} links of blocks, effects, controls and instructions point where they are.</li>
 * </ul>
 */
public class VerifySsa implements InPlaceIRPass<Function> {
    public static final VerifySsa INSTANCE = new VerifySsa();

    @Override
    public void runInPlace(Function func) {
        Map<BasicBlock, Set<BasicBlock>> recorded = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            if (block.getControl() == null) {
                throw new IllegalStateException("block " + block.toTargetString() + " has no control");
            }
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            recorded.put(block, new HashSet<>(preds));
        }
        ComputePreds.INSTANCE.runInPlace(func);

        Set<Var> assigned = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            checkOwner(block, CommonExts.OWNING_FUNCTION, func);
            checkOwner(block.getControl(), CommonExts.OWNING_BLOCK, block);
            checkOwner(block.getControl().insn(), CommonExts.OWNING_CONTROL, block.getControl());
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            if (!recorded.get(block).equals(new HashSet<>(preds))) {
                throw new IllegalStateException("predecessors of " + block.toTargetString()
                        + " were recorded as " + recorded.get(block) + " but are " + preds);
            }
            boolean inHead = true;
            for (Effect effect : block.getEffects()) {
                checkOwner(effect, CommonExts.OWNING_BLOCK, block);
                checkOwner(effect.insn(), CommonExts.OWNING_EFFECT, effect);
                for (Var var : effect.getAssignsTo()) {
                    if (!assigned.add(var)) {
                        throw new IllegalStateException("variable " + var + " assigned twice");
                    }
                }
                List<BasicBlock> phiPreds = CommonOps.PHI.argNullable(effect.insn().op);
                if (phiPreds == null) {
                    inHead = false;
                    continue;
                }
                if (!inHead) {
                    throw new IllegalStateException("phi after other effects in " + block.toTargetString());
                }
                if (phiPreds.size() != effect.insn().args().size()
                        || !new HashSet<>(phiPreds).equals(new HashSet<>(preds))) {
                    throw new IllegalStateException("phi " + effect + " does not match predecessors " + preds);
                }
            }
        }
    }

    private static <T> void checkOwner(ExtContainer owned, Ext<T> ext, T expected) {
        T owner = owned.getNullable(ext);
        if (owner != expected) {
            throw new IllegalStateException(owned + " is owned by " + owner + " but found in " + expected);
        }
    }
}
