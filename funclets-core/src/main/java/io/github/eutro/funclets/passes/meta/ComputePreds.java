package io.github.eutro.funclets.passes.meta;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.passes.InPlaceIRPass;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Function;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Computes {@link CommonExts#PREDS} for each block from the control instructions.
 * <p>
 * A block that jumps to the same target more than once is listed once.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : new LinkedHashSet<>(block.getControl().targets)) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }
    }
}
