package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.ExtHolder;
import io.github.eutro.funclets.ext.TrackedList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function in the IR: a list of basic blocks, the first of which is the entry.
 */
public final class Function extends ExtHolder {
    public static final boolean UNIQUE_VAR_NAMES = System.getenv("FUNCLETS_UNIQUE_VAR_NAMES") != null;

    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    };

    private final Map<String, Integer> varCounts = UNIQUE_VAR_NAMES ? new HashMap<>() : null;
    private int nextBlockId = 0;

    public Var newVar(String name) {
        if (varCounts == null) {
            return new Var(name, 0);
        }
        int index = varCounts.merge(name, 1, Integer::sum) - 1;
        return new Var(name, index);
    }

    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(nextBlockId++);
        blocks.add(bb);
        return bb;
    }

    public BasicBlock getEntry() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("fn {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.append('}').toString();
    }
}
