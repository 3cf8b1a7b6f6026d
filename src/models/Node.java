package models;

class Node<T> {
    T payload;
    Node<T> next;
    Node<T> prev;

    Node(T payload) {
        this.payload = payload;
    }

    boolean isDetached() {
        return next == null && prev == null;
    }

    @Override
    public String toString() {
        return "Node{" + payload + '}';
    }
}
