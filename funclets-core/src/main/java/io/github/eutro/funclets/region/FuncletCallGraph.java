package io.github.eutro.funclets.region;

import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.validate.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.github.eutro.funclets.validate.ValidationException.Kind.*;

/**
 * The call graph of one funclet region, built as the region is decoded.
 * <p>
 * Funclets are entered strictly in index order. A call whose target was already entered is
 * <i>backward</i>; its target's signature is known, so it is checked immediately, and it counts
 * towards the {@code num_preds} the target declared. Any other call is <i>forward</i>, and is
 * checked when its target is entered. A funclet is sealed, and the {@link SealListener} told,
 * once no further edge may target it.
 * <p>
 * Calls go through {@link #resolve(int, int, List, long)}, which only checks, and then
 * {@link #record(CallEdge)}, which commits. Anything the caller wires up in between sees the
 * graph as it was before the edge.
 */
public final class FuncletCallGraph {
    private static final Logger LOGGER = Logger.getLogger(FuncletCallGraph.class.getName());

    private final List<Funclet> funclets;
    private final List<CallEdge> edges = new ArrayList<>();
    private final SealListener listener;
    private int current = -1;

    /**
     * Create the graph of a region, recording the edge that enters it.
     *
     * @param numFunclets The number of funclets, which must be positive.
     * @param params      The parameter types of the region, passed to funclet 0.
     * @param offset      The offset of the region start.
     * @param listener    The listener to notify of seals.
     */
    public FuncletCallGraph(int numFunclets, List<ValType> params, long offset, SealListener listener) {
        if (numFunclets <= 0) throw new IllegalArgumentException("numFunclets: " + numFunclets);
        List<Funclet> funclets = new ArrayList<>(numFunclets);
        for (int i = 0; i < numFunclets; i++) {
            funclets.add(new Funclet(i));
        }
        this.funclets = Collections.unmodifiableList(funclets);
        this.listener = listener;
        record(new CallEdge(CallEdge.REGION_ENTRY, 0, params, offset, false));
    }

    public int size() {
        return funclets.size();
    }

    public Funclet get(int index) {
        return funclets.get(index);
    }

    public List<Funclet> funclets() {
        return funclets;
    }

    /**
     * Get the index of the funclet being decoded.
     *
     * @return The index, or -1 before funclet 0 is entered.
     */
    public int current() {
        return current;
    }

    public boolean isLast() {
        return current == funclets.size() - 1;
    }

    public List<CallEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public List<CallEdge> edgesTo(int index) {
        List<CallEdge> to = new ArrayList<>();
        for (CallEdge edge : edges) {
            if (edge.callee == index) to.add(edge);
        }
        return to;
    }

    /**
     * Whether all the predecessors of a funclet are known.
     *
     * @param index The funclet.
     * @return Whether it is complete.
     */
    public boolean isComplete(int index) {
        return funclets.get(index).isSealed();
    }

    /**
     * Check a call from {@code caller} to {@code caller + delta}, without recording it.
     *
     * @param caller   The calling funclet, which must be the current one.
     * @param delta    The relative index of the target.
     * @param argTypes The types passed.
     * @param offset   The offset of the call.
     * @return The edge, to be passed to {@link #record(CallEdge)}.
     * @throws ValidationException If the target is out of range, or it is a backward call that is
     *                             ill-typed or exceeds the target's declared predecessors.
     */
    public CallEdge resolve(int caller, int delta, List<ValType> argTypes, long offset) throws ValidationException {
        if (caller != current) {
            throw new IllegalStateException("call from funclet " + caller + " while decoding " + current);
        }
        long target = (long) caller + delta;
        if (target < 0 || target >= funclets.size()) {
            throw new ValidationException(STRUCTURAL_ERROR, offset,
                    "funclet call delta " + delta + " out of range for " + funclets.size() + " funclets")
                    .withFunclet(caller);
        }
        Funclet callee = funclets.get((int) target);
        boolean backward = callee.state != Funclet.State.UNVISITED;
        if (backward) {
            assert callee.signature != null;
            if (!ValType.allMatch(callee.signature.params, argTypes)) {
                throw new ValidationException(TYPE_MISMATCH, offset,
                        "arguments of backward call do not match signature")
                        .withFunclet(callee.index)
                        .withTypes(callee.signature.params, argTypes);
            }
            if (callee.isSealed()) {
                throw new ValidationException(PREDECESSOR_COUNT_ERROR, offset,
                        "backward call exceeds declared num_preds " + callee.declaredPreds)
                        .withFunclet(callee.index);
            }
        }
        return new CallEdge(caller, callee.index, argTypes, offset, backward);
    }

    /**
     * Commit an edge returned by {@link #resolve(int, int, List, long)}.
     * <p>
     * A backward edge may complete its target, in which case the target seals here.
     *
     * @param edge The edge.
     * @throws IllegalStateException If the edge targets a sealed funclet.
     */
    public void record(CallEdge edge) {
        Funclet callee = funclets.get(edge.callee);
        if (callee.isSealed()) {
            throw new IllegalStateException("edge " + edge + " targets sealed funclet " + callee.index);
        }
        edges.add(edge);
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("funclet edge " + edge);
        }
        if (edge.backward) {
            if (++callee.observedPreds == callee.declaredPreds) {
                seal(callee);
            }
        } else {
            callee.pending.add(edge);
        }
    }

    private void seal(Funclet funclet) {
        funclet.state = Funclet.State.SEALED;
        funclet.pending.clear();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("sealed " + funclet + " with " + funclet.observedPreds + " backward predecessors");
        }
        listener.onSeal(funclet);
    }

    /**
     * Enter the next funclet, fixing its signature.
     * <p>
     * Without {@code funclet_sig}, the signature is taken from the first forward edge. For funclet 0 that is the
     * region entry, so it takes the region's parameters, not the empty list.
     *
     * @param index         The funclet, which must come right after the current one.
     * @param explicitSig   The signature from {@code funclet_sig}, if it has one.
     * @param declaredPreds The number of backward calls it expects.
     * @param offset        The offset of the first instruction of the funclet.
     * @return The funclet.
     * @throws ValidationException If the signature cannot be determined, or disagrees with a forward call.
     */
    public Funclet enter(int index, @Nullable Signature explicitSig, int declaredPreds, long offset) throws ValidationException {
        if (index != current + 1 || index >= funclets.size()) {
            throw new IllegalStateException("entering funclet " + index + " after " + current);
        }
        Funclet funclet = funclets.get(index);
        Signature sig;
        if (explicitSig != null) {
            if (!explicitSig.results.isEmpty()) {
                throw new ValidationException(TYPE_MISMATCH, offset, "funclet signature has results")
                        .withFunclet(index)
                        .withTypes(Collections.emptyList(), explicitSig.results);
            }
            sig = explicitSig;
        } else if (!funclet.pending.isEmpty()) {
            sig = new Signature(funclet.pending.get(0).argTypes, Collections.emptyList());
        } else {
            throw new ValidationException(UNRESOLVED_SIGNATURE, offset,
                    "funclet has no signature and is not reachable from above")
                    .withFunclet(index);
        }
        for (CallEdge edge : funclet.pending) {
            if (!ValType.allMatch(sig.params, edge.argTypes)) {
                throw new ValidationException(TYPE_MISMATCH, edge.offset,
                        "arguments of forward call do not match signature")
                        .withFunclet(index)
                        .withTypes(sig.params, edge.argTypes);
            }
        }
        current = index;
        funclet.signature = sig;
        funclet.explicit = explicitSig != null;
        funclet.declaredPreds = declaredPreds;
        funclet.state = Funclet.State.UNSEALED;
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("entered " + funclet + ", " + funclet.pending.size()
                    + " forward predecessors, " + declaredPreds + " declared backward");
        }
        if (declaredPreds == 0) {
            seal(funclet);
        }
        return funclet;
    }

    /**
     * Check that the region is complete once its last funclet has ended.
     *
     * @param offset The offset of the end of the region.
     * @throws ValidationException If a funclet was never entered, or received fewer backward calls than it declared.
     */
    public void finish(long offset) throws ValidationException {
        if (current != funclets.size() - 1) {
            throw new ValidationException(STRUCTURAL_ERROR, offset,
                    "region ended after " + (current + 1) + " of " + funclets.size() + " funclets");
        }
        for (Funclet funclet : funclets) {
            if (funclet.observedPreds != funclet.declaredPreds) {
                throw new ValidationException(PREDECESSOR_COUNT_ERROR, offset,
                        "funclet declared " + funclet.declaredPreds + " backward predecessors, but "
                                + funclet.observedPreds + " were observed")
                        .withFunclet(funclet.index);
            }
        }
    }
}
