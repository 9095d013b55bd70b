package io.github.eutro.funclets.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A dense map from single-byte opcodes to values.
 *
 * @param <T> The type of value in the map.
 */
public class InsnMap<T> {
    @SuppressWarnings("unchecked")
    private final T[] byOpcode = (T[]) new Object[256];

    public @Nullable T get(byte opcode) {
        return byOpcode[Byte.toUnsignedInt(opcode)];
    }

    public boolean contains(byte opcode) {
        return get(opcode) != null;
    }

    public void put(byte opcode, @NotNull T value) {
        byOpcode[Byte.toUnsignedInt(opcode)] = value;
    }

    /**
     * Insert the same mapping for every opcode in {@code [from, to]}.
     *
     * @param from  The first opcode.
     * @param to    The last opcode, inclusive.
     * @param value The mapping.
     */
    public void putRange(int from, int to, @NotNull T value) {
        for (int opcode = from; opcode <= to; opcode++) {
            put((byte) opcode, value);
        }
    }

    /**
     * Get all the values in the map, in opcode order. The collection is a copy.
     *
     * @return The values.
     */
    public Collection<T> getValues() {
        List<T> values = new ArrayList<>();
        for (T t : byOpcode) {
            if (t != null) values.add(t);
        }
        return values;
    }
}
