package list.iterator;

import list.Lookup;

/**
 * Cursor over a list that can mutate the list around the element it last
 * returned. Any structural change made to the list through another path
 * invalidates the cursor.
 */
public interface IteratorInterface<T> {
    boolean hasNext();

    T next();

    /**
     * Removes the element returned by the last {@link #next()} call. A second
     * call without an intervening {@code next()} removes nothing.
     */
    Lookup<T> remove();

    /**
     * Inserts between the last returned element and the one that the next call
     * to {@link #next()} would return. The new element becomes the last returned
     * one.
     */
    void add(T element);

    Lookup<T> replace(T element);

    /**
     * @return list index of the last returned element
     */
    int index();
}
