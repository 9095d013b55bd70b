package io.github.eutro.funclets.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for a piece of metadata stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by creation order, so the relative order of two exts
 * is stable within one run but not across runs.
 *
 * @param <T> The type of the value associated with this ext.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class only serves debugging, it may be the erasure of {@code R}.
     *
     * @param type The erased type of values of the ext.
     * @param name The name of the ext.
     * @param <T>  The erased type.
     * @param <R>  The real type of the ext.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the (erased) type this ext was created with.
     *
     * @return The type.
     */
    public Class<?> getType() {
        return type;
    }

    /**
     * Get the name of this ext.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
