package io.github.eutro.funclets.ext;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list view that is notified of every element entering or leaving it.
 * <p>
 * Bulk operations and iterators are inherited from {@link AbstractList}, and
 * funnel through the single-element methods, so they are tracked too.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    protected TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        viewed.add(index, element);
        modCount++;
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        modCount++;
        return removed;
    }
}
