package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An {@link Insn instruction} whose results are assigned to variables.
 */
public final class Effect extends ExtHolder {
    private final List<Var> assignsTo;
    private final Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = Collections.unmodifiableList(assignsTo);
        this.insn = insn;
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        for (Var var : assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
    }

    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) return insn.toString();
        return assignsTo.stream()
                .map(Var::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }

    // exts
    private BasicBlock owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) return (T) owner;
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
