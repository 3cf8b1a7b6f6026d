package models;

/**
 * Relinking primitives. Nothing else writes {@code prev} or {@code next}.
 * None of these touch list state (head, tail, size); callers fix that up.
 */
final class Links {
    private Links() {
    }

    static <T> void insertBefore(Node<T> base, Node<T> node) {
        detach(node);
        final Node<T> left = base.prev;
        node.prev = left;
        node.next = base;
        if (left != null) {
            left.next = node;
        }
        base.prev = node;
    }

    static <T> void insertAfter(Node<T> base, Node<T> node) {
        detach(node);
        final Node<T> right = base.next;
        node.next = right;
        node.prev = base;
        if (right != null) {
            right.prev = node;
        }
        base.next = node;
    }

    /**
     * Exchanges the positions of two distinct nodes of the same chain.
     */
    static <T> void swap(Node<T> a, Node<T> b) {
        if (a.next == b) {
            swapAdjacent(a, b);
            return;
        }
        if (b.next == a) {
            swapAdjacent(b, a);
            return;
        }
        final Node<T> aLeft = a.prev;
        final Node<T> aRight = a.next;
        final Node<T> bLeft = b.prev;
        final Node<T> bRight = b.next;

        if (aLeft != null)
            aLeft.next = b;
        b.prev = aLeft;
        if (aRight != null)
            aRight.prev = b;
        b.next = aRight;

        if (bLeft != null)
            bLeft.next = a;
        a.prev = bLeft;
        if (bRight != null)
            bRight.prev = a;
        a.next = bRight;
    }

    // first.next == second
    private static <T> void swapAdjacent(Node<T> first, Node<T> second) {
        final Node<T> left = first.prev;
        final Node<T> right = second.next;
        if (right != null)
            right.prev = first;
        first.next = right;
        if (left != null)
            left.next = second;
        second.prev = left;
        first.prev = second;
        second.next = first;
    }

    static <T> T unlink(Node<T> node) {
        detach(node);
        return node.payload;
    }

    /**
     * Attaches the internally linked chain {@code first..last} between two
     * neighbouring nodes. A null boundary means that side is a chain end.
     */
    static <T> void linkChain(Node<T> left, Node<T> first, Node<T> last, Node<T> right) {
        first.prev = left;
        if (left != null) {
            left.next = first;
        }
        last.next = right;
        if (right != null) {
            right.prev = last;
        }
    }

    private static <T> void detach(Node<T> node) {
        final Node<T> left = node.prev;
        final Node<T> right = node.next;
        if (left != null) {
            left.next = right;
        }
        if (right != null) {
            right.prev = left;
        }
        node.prev = null;
        node.next = null;
    }
}
