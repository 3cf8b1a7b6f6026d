package models;

import list.ListError;
import list.ListException;
import list.ListInterface;
import list.Lookup;

import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;

public class DoublyLinkedList<T> implements ListInterface<T> {
    Node<T> head, tail;
    private int size;
    // bumped on every structural change, checked by iterators
    int modCount;

    @Override
    public void add(T element) {
        addLast(element);
    }

    @Override
    public void addFirst(T element) {
        addNodeFirst(newNode(element));
        size++;
        modCount++;
    }

    @Override
    public void addLast(T element) {
        addNodeLast(newNode(element));
        size++;
        modCount++;
    }

    @Override
    public void addAt(T element, int index) {
        if (size == 0) {
            throw new ListException(ListError.INVALID_ARGUMENT, "addAt on an empty list, use addFirst or addLast");
        }
        final Node<T> base = getNodeAt(index);
        final Node<T> node = newNode(element);
        Links.insertBefore(base, node);
        if (index == 0) {
            head = node;
        }
        size++;
        modCount++;
    }

    @Override
    public void addAll(ListInterface<? extends T> other) {
        final Node<T>[] chain = copyChain(other);
        if (tail == null) {
            head = chain[0];
        }
        Links.linkChain(tail, chain[0], chain[1], null);
        tail = chain[1];
        size += other.size();
        modCount++;
    }

    @Override
    public void addAllAt(ListInterface<? extends T> other, int index) {
        final Node<T> right = getNodeAt(index);
        final Node<T>[] chain = copyChain(other);
        Links.linkChain(right.prev, chain[0], chain[1], right);
        if (index == 0) {
            head = chain[0];
        }
        size += other.size();
        modCount++;
    }

    // Builds a detached copy first so a failed allocation leaves this list untouched.
    @SuppressWarnings("unchecked")
    private Node<T>[] copyChain(ListInterface<? extends T> other) {
        if (other == null || other.isEmpty()) {
            throw new ListException(ListError.INVALID_ARGUMENT, "source list is empty");
        }
        Node<T> first = null, last = null;
        for (final T element : other) {
            final Node<T> node = newNode(element);
            if (first == null) {
                first = node;
            } else {
                Links.insertAfter(last, node);
            }
            last = node;
        }
        return new Node[]{first, last};
    }

    @Override
    public T removeAt(int index) {
        return unlink(getNodeAt(index));
    }

    @Override
    public Lookup<T> remove(T element) {
        final Node<T> node = getNode(element);
        if (node == null) {
            return Lookup.notFound();
        }
        return Lookup.found(unlink(node));
    }

    @Override
    public T removeFirst() {
        if (size == 0) {
            throw ListException.empty("removeFirst");
        }
        return unlink(head);
    }

    @Override
    public T removeLast() {
        if (size == 0) {
            throw ListException.empty("removeLast");
        }
        return unlink(tail);
    }

    @Override
    public boolean removeAll() {
        return unlinkAll(null);
    }

    @Override
    public boolean removeAll(Consumer<? super T> destroyer) {
        Objects.requireNonNull(destroyer, "destroyer");
        return unlinkAll(destroyer);
    }

    private boolean unlinkAll(Consumer<? super T> destroyer) {
        if (size == 0) {
            return false;
        }
        Node<T> node = head;
        while (node != null) {
            final Node<T> next = node.next;
            final T payload = unlink(node);
            if (destroyer != null) {
                destroyer.accept(payload);
            }
            node = next;
        }
        return true;
    }

    @Override
    public T replaceAt(T element, int index) {
        final Node<T> node = getNodeAt(index);
        final T old = node.payload;
        node.payload = element;
        return old;
    }

    @Override
    public T get(int index) {
        return getNodeAt(index).payload;
    }

    @Override
    public T getFirst() {
        if (size == 0) {
            throw ListException.empty("getFirst");
        }
        return head.payload;
    }

    @Override
    public T getLast() {
        if (size == 0) {
            throw ListException.empty("getLast");
        }
        return tail.payload;
    }

    @Override
    public Lookup<T> lookup(int index) {
        if (index < 0 || index >= size) {
            return Lookup.notFound();
        }
        return Lookup.found(getNodeAt(index).payload);
    }

    @Override
    public Lookup<T> peekFirst() {
        return size == 0 ? Lookup.notFound() : Lookup.found(head.payload);
    }

    @Override
    public Lookup<T> peekLast() {
        return size == 0 ? Lookup.notFound() : Lookup.found(tail.payload);
    }

    /**
     * Moves every element of {@code other} to the end of this list in constant
     * time, leaving {@code other} empty.
     */
    public void splice(DoublyLinkedList<T> other) {
        spliceBetween(other, tail, null);
    }

    public void spliceBefore(DoublyLinkedList<T> other, int index) {
        final Node<T> right = getNodeAt(index);
        spliceBetween(other, right.prev, right);
    }

    public void spliceAfter(DoublyLinkedList<T> other, int index) {
        final Node<T> left = getNodeAt(index);
        spliceBetween(other, left, left.next);
    }

    private void spliceBetween(DoublyLinkedList<T> other, Node<T> left, Node<T> right) {
        if (other == this) {
            throw new ListException(ListError.INVALID_ARGUMENT, "cannot splice a list into itself");
        }
        if (other.size == 0) {
            return;
        }
        Links.linkChain(left, other.head, other.tail, right);
        if (left == null) {
            head = other.head;
        }
        if (right == null) {
            tail = other.tail;
        }
        size += other.size;
        modCount++;

        other.head = other.tail = null;
        other.size = 0;
        other.modCount++;
    }

    @Override
    public void reverse() {
        if (size < 2) {
            return;
        }
        final Node<T> oldHead = head;
        final Node<T> oldTail = tail;
        Node<T> left = head;
        Node<T> right = tail;
        for (int i = 0; i < size / 2; i++) {
            final Node<T> nextLeft = left.next;
            final Node<T> nextRight = right.prev;
            Links.swap(left, right);
            left = nextLeft;
            right = nextRight;
        }
        head = oldTail;
        tail = oldHead;
        modCount++;
    }

    /**
     * Stable in-place sort. The comparator must impose a total order.
     */
    @Override
    public void sort(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        if (size < 2) {
            return;
        }
        final MergeSort.Run<T> sorted = new MergeSort<T>(comparator).sort(head, size);
        head = sorted.first;
        tail = sorted.last;
        modCount++;
    }

    /**
     * @return a new list holding the elements from {@code begin} to {@code end},
     * both inclusive
     */
    @Override
    public DoublyLinkedList<T> sublist(int begin, int end) {
        if (begin < 0 || begin > end || end >= size) {
            throw new ListException(ListError.INDEX_OUT_OF_RANGE,
                    "sublist [" + begin + ", " + end + "] of a list of size " + size);
        }
        final DoublyLinkedList<T> sub = new DoublyLinkedList<>();
        Node<T> node = getNodeAt(begin);
        for (int i = begin; i <= end; i++) {
            sub.addLast(node.payload);
            node = node.next;
        }
        return sub;
    }

    @Override
    public DoublyLinkedList<T> copyShallow() {
        return copyDeep(Function.identity());
    }

    @Override
    public <R> DoublyLinkedList<R> copyDeep(Function<? super T, ? extends R> cloner) {
        Objects.requireNonNull(cloner, "cloner");
        final DoublyLinkedList<R> copy = new DoublyLinkedList<>();
        for (Node<T> node = head; node != null; node = node.next) {
            copy.addLast(cloner.apply(node.payload));
        }
        return copy;
    }

    @Override
    public Object[] toArray() {
        final Object[] array = new Object[size];
        int i = 0;
        for (Node<T> node = head; node != null; node = node.next) {
            array[i++] = node.payload;
        }
        return array;
    }

    @Override
    public T[] toArray(IntFunction<T[]> generator) {
        final T[] array = generator.apply(size);
        int i = 0;
        for (Node<T> node = head; node != null; node = node.next) {
            array[i++] = node.payload;
        }
        return array;
    }

    @Override
    public int contains(T element) {
        int count = 0;
        for (Node<T> node = head; node != null; node = node.next) {
            if (Objects.equals(node.payload, element)) {
                count++;
            }
        }
        return count;
    }

    @Override
    public int indexOf(T element) {
        int i = 0;
        for (Node<T> node = head; node != null; node = node.next) {
            if (Objects.equals(node.payload, element)) {
                return i;
            }
            i++;
        }
        return NO_SUCH_INDEX;
    }

    /**
     * Runs {@code action} on every element, head to tail. The action must not
     * modify this list.
     */
    @Override
    public void forEach(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action");
        final int expected = modCount;
        for (Node<T> node = head; node != null; node = node.next) {
            action.accept(node.payload);
            if (modCount != expected) {
                throw new ConcurrentModificationException("List modified during forEach");
            }
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public ForwardIterator<T> forwardIterator() {
        return new ForwardIterator<>(this);
    }

    @Override
    public ReverseIterator<T> reverseIterator() {
        return new ReverseIterator<>(this);
    }

    @Override
    public Iterator<T> iterator() {
        final ForwardIterator<T> cursor = forwardIterator();
        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public T next() {
                return cursor.next();
            }
        };
    }

    /**
     * Walks the chain in both directions and checks head, tail, size and
     * prev/next symmetry.
     *
     * @throws IllegalStateException describing the first broken invariant
     */
    public void verifyIntegrity() {
        if ((size == 0) != (head == null) || (size == 0) != (tail == null)) {
            fail("size " + size + " disagrees with head " + head + " / tail " + tail);
        }
        if (head != null && head.prev != null) {
            fail("head has a predecessor " + head.prev);
        }
        if (tail != null && tail.next != null) {
            fail("tail has a successor " + tail.next);
        }
        int forwardCount = 0;
        Node<T> last = null;
        for (Node<T> node = head; node != null; node = node.next) {
            if (node.prev != last) {
                fail("broken prev link at index " + forwardCount);
            }
            last = node;
            if (++forwardCount > size) {
                fail("forward walk exceeds size " + size);
            }
        }
        if (forwardCount != size || last != tail) {
            fail("forward walk counted " + forwardCount + " nodes, size is " + size);
        }
        int backwardCount = 0;
        for (Node<T> node = tail; node != null; node = node.prev) {
            if (++backwardCount > size) {
                fail("backward walk exceeds size " + size);
            }
        }
        if (backwardCount != size) {
            fail("backward walk counted " + backwardCount + " nodes, size is " + size);
        }
    }

    private void fail(String message) {
        System.err.println("Corrupted list: " + message);
        throw new IllegalStateException(message);
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder("[");
        int count = 0;
        for (Node<T> node = head; node != null; node = node.next) {
            if (count > 0) {
                s.append(", ");
            }
            s.append(node.payload);
            if (++count > size) {
                throw new IllegalStateException("Infinite Linked list? " + s);
            }
        }
        return s.append(']').toString();
    }

    T unlink(Node<T> node) {
        if (head == node)
            head = node.next;
        if (tail == node)
            tail = node.prev;
        final T payload = Links.unlink(node);
        size--;
        modCount++;
        return payload;
    }

    /**
     * Links a new node next to an iterator cursor: before it when moving
     * forward, after it when moving in reverse. A null cursor means the
     * iterator is exhausted, so the node goes to the tail (forward) or the head
     * (reverse).
     */
    Node<T> insertAtCursor(T element, Node<T> cursor, boolean forward) {
        final Node<T> node = newNode(element);
        if (cursor == null) {
            if (forward) {
                addNodeLast(node);
            } else {
                addNodeFirst(node);
            }
        } else if (forward) {
            Links.insertBefore(cursor, node);
            if (cursor == head) {
                head = node;
            }
        } else {
            Links.insertAfter(cursor, node);
            if (cursor == tail) {
                tail = node;
            }
        }
        size++;
        modCount++;
        return node;
    }

    private void addNodeFirst(Node<T> node) {
        if (head == null) {
            head = tail = node;
        } else {
            Links.insertBefore(head, node);
            head = node;
        }
    }

    private void addNodeLast(Node<T> node) {
        if (tail == null) {
            head = tail = node;
        } else {
            Links.insertAfter(tail, node);
            tail = node;
        }
    }

    // Walks from whichever end is closer, so at most size / 2 hops.
    Node<T> getNodeAt(int index) {
        if (index < 0 || index >= size) {
            throw ListException.indexOutOfRange(index, size);
        }
        Node<T> node;
        if (index < size / 2) {
            node = head;
            for (int i = 0; i < index; i++) {
                node = node.next;
            }
        } else {
            node = tail;
            for (int i = size - 1; i > index; i--) {
                node = node.prev;
            }
        }
        return node;
    }

    private Node<T> getNode(T element) {
        for (Node<T> node = head; node != null; node = node.next) {
            if (Objects.equals(node.payload, element)) {
                return node;
            }
        }
        return null;
    }

    private static <T> Node<T> newNode(T element) {
        try {
            return new Node<>(element);
        } catch (OutOfMemoryError e) {
            throw new ListException(ListError.ALLOCATION_FAILURE, "cannot allocate a list node", e);
        }
    }
}
