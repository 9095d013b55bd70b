package io.github.eutro.funclets.validate;

import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.region.FuncletRegion;
import io.github.eutro.funclets.ssa.BasicBlock;
import io.github.eutro.funclets.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A control frame of the validator: the function itself, a block, loop or if, or a funclet region.
 */
public final class ControlFrame {
    public enum Kind {
        FUNCTION,
        BLOCK,
        LOOP,
        IF,
        ELSE,
        REGION,
    }

    public Kind kind;
    public final Signature type;
    /**
     * The operand stack height below the frame's parameters.
     */
    public final int height;
    public boolean unreachable;

    /**
     * Where branches to this frame go: the loop header for loops, the continuation otherwise.
     * Null for the function frame, where branches return.
     */
    public final @Nullable BasicBlock label;

    /**
     * The false branch of an if without its else, still to be wired to the continuation.
     */
    public @Nullable BasicBlock elseBb;
    /**
     * The parameters of an if, which the else branch starts with.
     */
    public @Nullable List<Var> paramVals;

    public @Nullable FuncletRegion region;
    /**
     * Whether a funclet of this region has ended and the next has not begun.
     */
    public boolean betweenFunclets;

    ControlFrame(Kind kind, Signature type, int height, @Nullable BasicBlock label) {
        this.kind = kind;
        this.type = type;
        this.height = height;
        this.label = label;
    }

    public List<ValType> labelTypes() {
        return kind == Kind.LOOP ? type.params : type.results;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + type + " @" + height + (unreachable ? " (unreachable)" : "");
    }
}
