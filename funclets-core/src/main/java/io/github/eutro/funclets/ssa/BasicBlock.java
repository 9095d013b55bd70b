package io.github.eutro.funclets.ssa;

import io.github.eutro.funclets.ext.CommonExts;
import io.github.eutro.funclets.ext.Ext;
import io.github.eutro.funclets.ext.ExtHolder;
import io.github.eutro.funclets.ext.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a list of {@link Effect}s, followed by exactly one {@link Control}.
 */
public final class BasicBlock extends ExtHolder {
    /**
     * The number of this block within its function, in creation order.
     */
    public final int id;

    private final List<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock(int id) {
        this.id = id;
    }

    /**
     * Format this block as a jump target.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "@" + id;
    }

    /**
     * Get the effects of this block. The list is mutable, and keeps {@link CommonExts#OWNING_BLOCK} up to date.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    public Control getControl() {
        return control;
    }

    public void setControl(Control control) {
        if (this.control != null) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        this.control = control;
        control.attachExt(CommonExts.OWNING_BLOCK, this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(":\n");
        for (Effect effect : effects) {
            sb.append("  ").append(effect).append('\n');
        }
        sb.append("  ").append(control == null ? "<no control>" : control);
        return sb.toString();
    }

    // exts
    private Function owner;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) return (T) owner;
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
