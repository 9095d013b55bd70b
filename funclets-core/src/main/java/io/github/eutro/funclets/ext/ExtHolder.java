package io.github.eutro.funclets.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An {@link ExtContainer} backed by a small sorted array of key-value pairs.
 * <p>
 * Almost every holder carries zero, one or two exts, so nothing is allocated
 * until the first ext is attached, and lookups are a binary search over at most a handful of entries.
 */
public class ExtHolder implements ExtContainer {
    private static final Object[] EMPTY = new Object[0];

    // [ext0, value0, ext1, value1, ...], sorted by ext
    private Object[] entries = EMPTY;

    private int find(Ext<?> ext) {
        int lo = 0;
        int hi = entries.length / 2 - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = ((Ext<?>) entries[mid * 2]).compareTo(ext);
            if (cmp < 0) lo = mid + 1;
            else if (cmp > 0) hi = mid - 1;
            else return mid;
        }
        return -(lo + 1);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int idx = find(ext);
        if (idx >= 0) {
            entries[idx * 2 + 1] = value;
            return;
        }
        int at = -(idx + 1) * 2;
        Object[] grown = new Object[entries.length + 2];
        System.arraycopy(entries, 0, grown, 0, at);
        System.arraycopy(entries, at, grown, at + 2, entries.length - at);
        grown[at] = ext;
        grown[at + 1] = value;
        entries = grown;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int idx = find(ext);
        if (idx < 0) return;
        if (entries.length == 2) {
            entries = EMPTY;
            return;
        }
        int at = idx * 2;
        Object[] shrunk = Arrays.copyOf(entries, entries.length - 2);
        System.arraycopy(entries, at + 2, shrunk, at, entries.length - at - 2);
        entries = shrunk;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (entries.length == 0) return null;
        int idx = find(ext);
        return idx < 0 ? null : (T) entries[idx * 2 + 1];
    }
}
