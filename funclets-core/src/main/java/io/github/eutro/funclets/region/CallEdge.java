package io.github.eutro.funclets.region;

import io.github.eutro.funclets.bytecode.ValType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A tail call from one funclet to another in the same region, with the types it passed.
 * <p>
 * Edges refer to funclets by index, so a graph of them never holds references between funclets.
 */
public final class CallEdge {
    /**
     * The caller index of the edge into funclet 0 that enters the region.
     */
    public static final int REGION_ENTRY = -1;

    public final int caller;
    public final int callee;
    public final List<ValType> argTypes;
    public final long offset;
    /**
     * Whether the callee had already been entered when this edge was made.
     */
    public final boolean backward;

    public CallEdge(int caller, int callee, List<ValType> argTypes, long offset, boolean backward) {
        this.caller = caller;
        this.callee = callee;
        this.argTypes = Collections.unmodifiableList(new ArrayList<>(argTypes));
        this.offset = offset;
        this.backward = backward;
    }

    public boolean isRegionEntry() {
        return caller == REGION_ENTRY;
    }

    @Override
    public String toString() {
        return (isRegionEntry() ? "entry" : String.valueOf(caller))
                + (backward ? " <- " : " -> ") + callee + " " + ValType.format(argTypes);
    }
}
