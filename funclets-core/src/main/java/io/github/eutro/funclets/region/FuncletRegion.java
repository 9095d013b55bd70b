package io.github.eutro.funclets.region;

import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.ssa.BasicBlock;

import java.util.List;

/**
 * A funclet region of a function body, as validated.
 */
public final class FuncletRegion {
    /**
     * The position of the region in the body, counting region starts in order.
     */
    public final int index;
    public final Signature signature;
    /**
     * The number of control frames enclosing the region.
     */
    public final int depth;
    public final long offset;
    /**
     * The operand stack height below the region's parameters.
     */
    public final int mark;
    public final FuncletCallGraph graph;
    /**
     * The block that branches out of the region, and the end of its last funclet, jump to.
     */
    public final BasicBlock exit;

    public FuncletRegion(int index, Signature signature, int depth, long offset, int mark,
                         FuncletCallGraph graph, BasicBlock exit) {
        this.index = index;
        this.signature = signature;
        this.depth = depth;
        this.offset = offset;
        this.mark = mark;
        this.graph = graph;
        this.exit = exit;
    }

    public List<Funclet> getFunclets() {
        return graph.funclets();
    }

    public Funclet getFunclet(int index) {
        return graph.get(index);
    }

    public int size() {
        return graph.size();
    }

    @Override
    public String toString() {
        return String.format("region %d at 0x%x %s, %d funclets", index, offset, signature, size());
    }
}
