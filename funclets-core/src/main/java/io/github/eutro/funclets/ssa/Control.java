package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The instruction ending a {@link BasicBlock}, together with its jump targets.
 */
public final class Control extends ExtHolder {
    private final Insn insn;
    /**
     * The targets; what their order means depends on the operation.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        this.insn = insn;
        this.targets = targets;
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
    }

    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
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
