package models;

public final class ReverseIterator<T> extends ListIter<T> {

    ReverseIterator(DoublyLinkedList<T> list) {
        super(list, list.tail, list.size() - 1);
    }

    @Override
    protected boolean forward() {
        return false;
    }

    @Override
    Node<T> advance(Node<T> node) {
        return node.prev;
    }

    // removed and added nodes sit after the cursor, so its index holds
    @Override
    protected void afterRemove() {
    }

    @Override
    protected void afterAdd() {
    }
}
