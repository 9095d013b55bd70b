package io.github.eutro.funclets.ext;

import io.github.eutro.funclets.ssa.*;

import java.util.List;
import java.util.Set;

/**
 * Exts shared by all of the IR.
 */
public class CommonExts {
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");
    public static final Ext<Set<Insn>> USED_AT = Ext.create(Set.class, "USED_AT");

    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");
}
