package list;

import list.iterator.IteratorInterface;

import java.util.Comparator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Ordered sequence backed by a chain of doubly linked nodes. Not thread safe:
 * callers sharing an instance across threads must serialize access themselves.
 */
public interface ListInterface<T> extends Iterable<T> {
    int NO_SUCH_INDEX = -1;

    void add(T element);

    void addFirst(T element);

    void addLast(T element);

    /**
     * Inserts before the element currently at {@code index}. An empty list has
     * no such element, so insertion there must go through addFirst or addLast.
     */
    void addAt(T element, int index);

    void addAll(ListInterface<? extends T> other);

    void addAllAt(ListInterface<? extends T> other, int index);

    T removeAt(int index);

    Lookup<T> remove(T element);

    T removeFirst();

    T removeLast();

    /**
     * @return false if the list was already empty
     */
    boolean removeAll();

    /**
     * Same as {@link #removeAll()} but hands every removed payload to
     * {@code destroyer}, head to tail.
     */
    boolean removeAll(Consumer<? super T> destroyer);

    T replaceAt(T element, int index);

    T get(int index);

    T getFirst();

    T getLast();

    Lookup<T> lookup(int index);

    Lookup<T> peekFirst();

    Lookup<T> peekLast();

    void reverse();

    void sort(Comparator<? super T> comparator);

    ListInterface<T> sublist(int begin, int end);

    ListInterface<T> copyShallow();

    <R> ListInterface<R> copyDeep(Function<? super T, ? extends R> cloner);

    Object[] toArray();

    T[] toArray(IntFunction<T[]> generator);

    /**
     * @return number of elements equal to {@code element}
     */
    int contains(T element);

    int indexOf(T element);

    int size();

    boolean isEmpty();

    IteratorInterface<T> forwardIterator();

    IteratorInterface<T> reverseIterator();
}
