package models;

import list.Lookup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ListIterTest {

    private static DoublyLinkedList<Integer> listOf(int... values) {
        final DoublyLinkedList<Integer> list = new DoublyLinkedList<>();
        for (int v : values) {
            list.add(v);
        }
        return list;
    }

    @Test
    void forwardRemoveThenAddScenario() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3, 4, 5);
        final ForwardIterator<Integer> it = list.forwardIterator();
        assertEquals(1, it.next());
        assertEquals(2, it.next());
        assertEquals(3, it.next());
        assertEquals(Lookup.found(3), it.remove());
        it.add(9);
        final List<Integer> rest = new ArrayList<>();
        while (it.hasNext()) {
            rest.add(it.next());
        }
        assertEquals(List.of(4, 5), rest);
        list.verifyIntegrity();
        assertArrayEquals(new Object[]{1, 2, 9, 4, 5}, list.toArray());
    }

    @Test
    void secondRemoveWithoutNextRemovesNothing() {
        final DoublyLinkedList<Integer> list = listOf(1, 2);
        final ForwardIterator<Integer> it = list.forwardIterator();
        assertFalse(it.remove().isFound());
        it.next();
        assertTrue(it.remove().isFound());
        assertEquals(Lookup.notFound(), it.remove());
        assertEquals(1, list.size());
        assertEquals(2, it.next());
    }

    @Test
    void forwardIndexTracksLastReturned() {
        final DoublyLinkedList<Integer> list = listOf(10, 11, 12);
        final ForwardIterator<Integer> it = list.forwardIterator();
        it.next();
        it.next();
        assertEquals(1, it.index());
        it.remove();
        it.add(5);
        assertEquals(1, it.index());
        assertEquals(12, it.next());
        assertEquals(2, it.index());
        assertArrayEquals(new Object[]{10, 5, 12}, list.toArray());
    }

    @Test
    void forwardAddOnFreshIteratorBecomesHead() {
        final DoublyLinkedList<Integer> list = listOf(2);
        final ForwardIterator<Integer> it = list.forwardIterator();
        it.add(1);
        assertEquals(0, it.index());
        assertEquals(1, list.getFirst());
        assertEquals(2, it.next());
        list.verifyIntegrity();
    }

    @Test
    void forwardAddWhenExhaustedAppends() {
        final DoublyLinkedList<Integer> list = listOf(1);
        final ForwardIterator<Integer> it = list.forwardIterator();
        it.next();
        it.add(2);
        assertFalse(it.hasNext());
        assertEquals(2, list.getLast());
        list.verifyIntegrity();

        final DoublyLinkedList<Integer> empty = new DoublyLinkedList<>();
        empty.forwardIterator().add(7);
        assertArrayEquals(new Object[]{7}, empty.toArray());
        empty.verifyIntegrity();
    }

    @Test
    void nextPastEndThrows() {
        final ForwardIterator<Integer> it = new DoublyLinkedList<Integer>().forwardIterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void replaceSwapsLastReturnedPayload() {
        final DoublyLinkedList<String> list = new DoublyLinkedList<>();
        list.add("a");
        list.add("b");
        final ForwardIterator<String> it = list.forwardIterator();
        assertFalse(it.replace("z").isFound());
        it.next();
        assertEquals(Lookup.found("a"), it.replace("x"));
        it.remove();
        assertFalse(it.replace("y").isFound());
        assertArrayEquals(new Object[]{"b"}, list.toArray());
    }

    @Test
    void removeWholeListThroughIterator() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3);
        final ForwardIterator<Integer> it = list.forwardIterator();
        while (it.hasNext()) {
            it.next();
            it.remove();
        }
        assertTrue(list.isEmpty());
        list.verifyIntegrity();
    }

    @Test
    void reverseVisitsTailToHead() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3);
        final ReverseIterator<Integer> it = list.reverseIterator();
        final List<Integer> seen = new ArrayList<>();
        while (it.hasNext()) {
            seen.add(it.next());
            assertEquals(3 - seen.size(), it.index());
        }
        assertEquals(List.of(3, 2, 1), seen);
    }

    @Test
    void reverseAddMirrorsForwardAdd() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3, 4, 5);
        final ReverseIterator<Integer> it = list.reverseIterator();
        it.next();
        it.next();
        it.next();
        assertEquals(Lookup.found(3), it.remove());
        it.add(9);
        assertEquals(2, it.index());
        assertEquals(2, it.next());
        assertEquals(1, it.next());
        assertFalse(it.hasNext());
        list.verifyIntegrity();
        assertArrayEquals(new Object[]{1, 2, 9, 4, 5}, list.toArray());
    }

    @Test
    void reverseAddOnFreshIteratorBecomesTail() {
        final DoublyLinkedList<Integer> list = listOf(1);
        final ReverseIterator<Integer> it = list.reverseIterator();
        it.add(2);
        assertEquals(1, it.index());
        assertEquals(2, list.getLast());
        assertEquals(1, it.next());
        list.verifyIntegrity();
    }

    @Test
    void reverseAddWhenExhaustedPrepends() {
        final DoublyLinkedList<Integer> list = listOf(1);
        final ReverseIterator<Integer> it = list.reverseIterator();
        it.next();
        it.add(0);
        assertEquals(0, it.index());
        assertEquals(0, list.getFirst());
        list.verifyIntegrity();
    }

    @Test
    void reverseRemoveHeadAndTail() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3);
        final ReverseIterator<Integer> it = list.reverseIterator();
        it.next();
        it.remove();
        it.next();
        it.next();
        it.remove();
        assertArrayEquals(new Object[]{2}, list.toArray());
        list.verifyIntegrity();
    }

    @Test
    void externalChangeInvalidatesIterator() {
        final DoublyLinkedList<Integer> list = listOf(1, 2, 3);
        final ForwardIterator<Integer> first = list.forwardIterator();
        final ForwardIterator<Integer> second = list.forwardIterator();
        first.next();
        second.next();
        second.remove();
        assertThrows(ConcurrentModificationException.class, first::next);
        assertThrows(ConcurrentModificationException.class, first::remove);
        assertThrows(ConcurrentModificationException.class, () -> first.add(4));
        assertEquals(2, second.next());

        list.addFirst(0);
        assertThrows(ConcurrentModificationException.class, second::hasNext);
    }

    @Test
    void enhancedForLoopIsReadOnly() {
        final DoublyLinkedList<Integer> list = listOf(1, 2);
        int sum = 0;
        for (int v : list) {
            sum += v;
        }
        assertEquals(3, sum);
        assertThrows(UnsupportedOperationException.class, () -> list.iterator().remove());
    }
}
