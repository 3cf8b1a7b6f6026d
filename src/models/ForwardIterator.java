package models;

public final class ForwardIterator<T> extends ListIter<T> {

    ForwardIterator(DoublyLinkedList<T> list) {
        super(list, list.head, 0);
    }

    @Override
    protected boolean forward() {
        return true;
    }

    @Override
    Node<T> advance(Node<T> node) {
        return node.next;
    }

    // everything after the removed node shifts one place towards the head
    @Override
    protected void afterRemove() {
        position--;
    }

    @Override
    protected void afterAdd() {
        position++;
    }
}
