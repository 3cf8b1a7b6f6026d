package models;

import list.Lookup;
import list.iterator.IteratorInterface;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;

/**
 * Shared cursor state for both traversal directions. Subclasses decide which
 * way the cursor moves and on which side of it {@link #add} inserts.
 */
public abstract class ListIter<T> implements IteratorInterface<T> {
    protected final DoublyLinkedList<T> list;
    Node<T> next;
    Node<T> last;
    // list index of next, or where it would be once exhausted
    protected int position;
    private int expectedModCount;

    ListIter(DoublyLinkedList<T> list, Node<T> start, int position) {
        this.list = list;
        this.next = start;
        this.position = position;
        this.expectedModCount = list.modCount;
    }

    @Override
    public boolean hasNext() {
        checkForComodification();
        return next != null;
    }

    @Override
    public T next() {
        checkForComodification();
        if (next == null) {
            throw new NoSuchElementException("Iterator exhausted at index " + position);
        }
        last = next;
        next = advance(next);
        position += step();
        return last.payload;
    }

    @Override
    public Lookup<T> remove() {
        checkForComodification();
        if (last == null) {
            return Lookup.notFound();
        }
        final T payload = list.unlink(last);
        afterRemove();
        last = null;
        expectedModCount = list.modCount;
        return Lookup.found(payload);
    }

    @Override
    public void add(T element) {
        checkForComodification();
        last = list.insertAtCursor(element, next, forward());
        afterAdd();
        expectedModCount = list.modCount;
    }

    @Override
    public Lookup<T> replace(T element) {
        checkForComodification();
        if (last == null) {
            return Lookup.notFound();
        }
        final T old = last.payload;
        last.payload = element;
        return Lookup.found(old);
    }

    @Override
    public int index() {
        return position - step();
    }

    protected abstract boolean forward();

    abstract Node<T> advance(Node<T> node);

    protected int step() {
        return forward() ? 1 : -1;
    }

    protected abstract void afterRemove();

    protected abstract void afterAdd();

    private void checkForComodification() {
        if (list.modCount != expectedModCount) {
            throw new ConcurrentModificationException(
                    "List changed outside this iterator at index " + position);
        }
    }
}
