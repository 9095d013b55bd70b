package io.github.eutro.funclets.region;

import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.ssa.BasicBlock;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A funclet, identified by its index in the owning region.
 * <p>
 * Only {@link FuncletCallGraph} changes the state of a funclet.
 */
public final class Funclet {
    public enum State {
        /**
         * Not entered yet. Only forward edges may target it.
         */
        UNVISITED,
        /**
         * Entered, waiting on backward edges.
         */
        UNSEALED,
        /**
         * All predecessors known.
         */
        SEALED,
    }

    public final int index;
    State state = State.UNVISITED;
    @Nullable Signature signature;
    boolean explicit;
    int declaredPreds;
    int observedPreds;
    final List<CallEdge> pending = new ArrayList<>();
    private @Nullable BasicBlock entry;

    Funclet(int index) {
        this.index = index;
    }

    public State getState() {
        return state;
    }

    public boolean isSealed() {
        return state == State.SEALED;
    }

    /**
     * Get the signature of this funclet. Its results are always empty.
     *
     * @return The signature, or null if the funclet was not entered yet.
     */
    public @Nullable Signature getSignature() {
        return signature;
    }

    /**
     * Whether the signature was declared with {@code funclet_sig}, rather than inferred from forward calls.
     *
     * @return Whether it is explicit.
     */
    public boolean isExplicit() {
        return explicit;
    }

    public int getDeclaredPreds() {
        return declaredPreds;
    }

    public int getObservedPreds() {
        return observedPreds;
    }

    /**
     * Get the block that calls to this funclet jump to, if one was assigned.
     *
     * @return The entry block.
     */
    public @Nullable BasicBlock getEntry() {
        return entry;
    }

    public void setEntry(BasicBlock entry) {
        this.entry = entry;
    }

    @Override
    public String toString() {
        return "funclet " + index + " (" + state.name().toLowerCase() + ")"
                + (signature == null ? "" : " " + signature);
    }
}
