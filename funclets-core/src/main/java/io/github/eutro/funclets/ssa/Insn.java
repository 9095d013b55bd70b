package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtHolder;
import io.github.eutro.funclets.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * An instruction: an {@link Op} applied to some argument variables.
 * <p>
 * An instruction is either wrapped in an {@link Effect}, which assigns its results,
 * or in a {@link Control}, which gives its jump targets.
 */
public final class Insn extends ExtHolder implements Iterable<Var> {
    public static final boolean TRACK_INSN_CREATIONS = System.getenv("FUNCLETS_TRACK_INSN_CREATIONS") != null;

    /**
     * Where this instruction was constructed, if {@link #TRACK_INSN_CREATIONS} is set.
     */
    public final @Nullable Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    /**
     * Get the arguments of this instruction. The list is mutable.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return new Control(this, new ArrayList<>(Arrays.asList(targets)));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    // exts
    private Object owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        }
        if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
