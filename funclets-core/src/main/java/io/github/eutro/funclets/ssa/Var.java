package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * A variable, or virtual register.
 * <p>
 * IR produced by the validator is in SSA form, so every variable is assigned by exactly one {@link Effect}.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable, for debugging.
     */
    public final String name;
    /**
     * Distinguishes variables of the same name, if {@link Function#UNIQUE_VAR_NAMES} is set.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return index == 0 ? '$' + name : '$' + name + "." + index;
    }

    // hot exts live in fields
    private Effect assignedAt;
    private Set<Insn> usedAt;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) return (T) assignedAt;
        if (ext == CommonExts.USED_AT) return (T) usedAt;
        return super.getNullable(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = (Set<Insn>) value;
        } else {
            super.attachExt(ext, value);
        }
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
        } else if (ext == CommonExts.USED_AT) {
            usedAt = null;
        } else {
            super.removeExt(ext);
        }
    }
}
