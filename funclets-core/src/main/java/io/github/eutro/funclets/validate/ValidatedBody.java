package io.github.eutro.funclets.validate;

import io.github.eutro.funclets.bytecode.Signature;
import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.region.FuncletRegion;
import io.github.eutro.funclets.ssa.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function body that passed validation: its SSA IR and its funclet regions.
 */
public final class ValidatedBody {
    public final int funcIndex;
    public final Signature type;
    /**
     * The types of all locals, parameters first.
     */
    public final List<ValType> locals;
    public final Function func;
    public final List<FuncletRegion> regions;

    ValidatedBody(int funcIndex, Signature type, List<ValType> locals, Function func, List<FuncletRegion> regions) {
        this.funcIndex = funcIndex;
        this.type = type;
        this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
        this.func = func;
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
    }

    public int funcletCount() {
        int count = 0;
        for (FuncletRegion region : regions) {
            count += region.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "func " + funcIndex + " " + type + ": " + func.blocks.size() + " blocks, "
                + regions.size() + " regions, " + funcletCount() + " funclets";
    }
}
