package io.github.eutro.funclets.validate;

import io.github.eutro.funclets.bytecode.ValType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The abstract operand stack: types only, with heights used as marks.
 * <p>
 * This knows nothing of unreachable code. Callers pop with {@link #popAbove(int)} and decide
 * for themselves what reaching the floor means.
 */
public final class OperandTypeStack {
    private final List<ValType> types = new ArrayList<>();

    public void push(ValType type) {
        types.add(type);
    }

    public void pushAll(List<ValType> toPush) {
        types.addAll(toPush);
    }

    /**
     * Pop the top type.
     *
     * @return The type.
     * @throws IllegalStateException If the stack is empty.
     */
    public ValType pop() {
        if (types.isEmpty()) {
            throw new IllegalStateException("pop from empty operand stack");
        }
        return types.remove(types.size() - 1);
    }

    /**
     * Pop the top type, unless the stack is no higher than {@code floor}.
     *
     * @param floor The height to stop at.
     * @return The type, or null if the stack was at the floor.
     */
    public @Nullable ValType popAbove(int floor) {
        if (types.size() <= floor) return null;
        return pop();
    }

    public @Nullable ValType peek() {
        return types.isEmpty() ? null : types.get(types.size() - 1);
    }

    public int mark() {
        return types.size();
    }

    public int height() {
        return types.size();
    }

    /**
     * Get the types above a height, bottom first. The list is a snapshot.
     *
     * @param height The height.
     * @return The types.
     */
    public List<ValType> valuesAbove(int height) {
        if (height >= types.size()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(types.subList(height, types.size())));
    }

    public void truncate(int height) {
        if (height < 0) throw new IllegalArgumentException("negative height " + height);
        if (height < types.size()) {
            types.subList(height, types.size()).clear();
        }
    }

    @Override
    public String toString() {
        return ValType.format(types);
    }
}
