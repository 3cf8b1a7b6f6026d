package models;

import java.util.Comparator;

/**
 * Top-down merge sort over a node chain. Nodes are moved with
 * {@link Links#insertBefore}, never copied, so no buffer is allocated.
 */
final class MergeSort<T> {
    private final Comparator<? super T> comparator;

    MergeSort(Comparator<? super T> comparator) {
        this.comparator = comparator;
    }

    static final class Run<T> {
        final Node<T> first;
        final Node<T> last;

        Run(Node<T> first, Node<T> last) {
            this.first = first;
            this.last = last;
        }
    }

    Run<T> sort(Node<T> head, int size) {
        return split(head, size);
    }

    // On an odd count the right half takes the extra node.
    private Run<T> split(Node<T> first, int size) {
        if (size < 2) {
            return new Run<>(first, first);
        }
        final int leftSize = size / 2;
        final int rightSize = size - leftSize;
        Node<T> center = first;
        for (int i = 0; i < leftSize; i++) {
            center = center.next;
        }
        final Run<T> left = split(first, leftSize);
        final Run<T> right = split(center, rightSize);
        return merge(left.first, leftSize, right.first, rightSize);
    }

    /**
     * Merges two adjacent sorted runs, the left run immediately followed by the
     * right one. Ties keep the left node in front.
     */
    private Run<T> merge(Node<T> left, int leftSize, Node<T> right, int rightSize) {
        Node<T> first = left;
        Node<T> l = left;
        Node<T> r = right;
        int leftTaken = 0;
        int rightTaken = 0;
        while (true) {
            if (comparator.compare(l.payload, r.payload) <= 0) {
                leftTaken++;
                if (leftTaken == leftSize) {
                    for (; rightTaken < rightSize - 1; rightTaken++) {
                        r = r.next;
                    }
                    return new Run<>(first, r);
                }
                l = l.next;
            } else {
                final Node<T> nextRight = r.next;
                if (leftTaken == 0 && rightTaken == 0) {
                    first = r;
                }
                Links.insertBefore(l, r);
                rightTaken++;
                if (rightTaken == rightSize) {
                    for (; leftTaken < leftSize - 1; leftTaken++) {
                        l = l.next;
                    }
                    return new Run<>(first, l);
                }
                r = nextRight;
            }
        }
    }
}
