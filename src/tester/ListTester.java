package tester;

import list.ListError;
import list.ListException;
import list.Lookup;
import models.DoublyLinkedList;
import models.ForwardIterator;
import models.ReverseIterator;
import tester.models.Request;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Replays random operation sequences against {@link DoublyLinkedList} and an
 * {@link ArrayList} reference model, checking contents and chain integrity
 * after every request.
 */
public class ListTester {
    public static void main(String[] args) {
        final long seed = args.length > 0 ? Long.parseLong(args[0]) : System.nanoTime();
        final int rounds = args.length > 1 ? Integer.parseInt(args[1]) : 20;
        final int requestsPerRound = args.length > 2 ? Integer.parseInt(args[2]) : 2000;
        final List<OperationGenerator> generators = Arrays.asList(
                new OperationGenerator(0.1, 10, seed),
                new OperationGenerator(0.5, 50, seed + 1),
                new OperationGenerator(0.8, 1000, seed + 2)
        );
        System.out.println("Seed: " + seed);
        for (final OperationGenerator generator : generators) {
            for (int round = 0; round < rounds; round++) {
                final var requests = generator.setupRequests(requestsPerRound);
                System.out.println("Configuration: addProbability: " + generator.getAddProbability()
                        + " + round: " + round
                        + " + requests: " + requestsPerRound);
                try {
                    testList(requests);
                } catch (IllegalStateException e) {
                    e.printStackTrace();
                    System.exit(1);
                }
            }
        }
        System.exit(0);
    }

    /**
     * @return the final list contents
     * @throws IllegalStateException on the first mismatch with the reference model
     */
    public static List<Integer> testList(List<Request> requests) {
        final long startTime = System.nanoTime();
        final DoublyLinkedList<Integer> list = new DoublyLinkedList<>();
        final List<Integer> model = new ArrayList<>();
        for (final Request request : requests) {
            try {
                apply(request, list, model);
                list.verifyIntegrity();
            } catch (RuntimeException e) {
                System.err.println("Failed on request: " + request + " list: " + list + " model: " + model);
                throw new IllegalStateException("Request " + request.getId() + " failed", e);
            }
            if (!Arrays.equals(list.toArray(), model.toArray())) {
                System.err.println("Mismatch in list state: " + list + " and expected: " + model + " after request: " + request);
                throw new IllegalStateException("Mismatch after request " + request.getId());
            }
        }
        System.out.println("PASSED IN " + (System.nanoTime() - startTime) / 1000000000d + " SECONDS");
        return model;
    }

    private static void apply(Request request, DoublyLinkedList<Integer> list, List<Integer> model) {
        final int value = request.getValue();
        final int size = model.size();
        final int index = size == 0 ? 0 : request.getIndex() % size;
        switch (request.getType()) {
            case ADD_FIRST:
                list.addFirst(value);
                model.add(0, value);
                break;
            case ADD_LAST:
                list.addLast(value);
                model.add(value);
                break;
            case ADD_AT:
                if (size == 0) {
                    expectError(ListError.INVALID_ARGUMENT, () -> list.addAt(value, 0));
                } else {
                    list.addAt(value, index);
                    model.add(index, value);
                }
                break;
            case REMOVE_AT:
                if (size == 0) {
                    expectError(ListError.INDEX_OUT_OF_RANGE, () -> list.removeAt(0));
                } else {
                    expectEqual(model.remove(index), list.removeAt(index));
                }
                break;
            case REMOVE:
                final Lookup<Integer> removed = list.remove(value);
                expectEqual(model.remove(Integer.valueOf(value)), removed.isFound());
                break;
            case REMOVE_FIRST:
                if (size == 0) {
                    expectError(ListError.EMPTY_COLLECTION, list::removeFirst);
                } else {
                    expectEqual(model.remove(0), list.removeFirst());
                }
                break;
            case REMOVE_LAST:
                if (size == 0) {
                    expectError(ListError.EMPTY_COLLECTION, list::removeLast);
                } else {
                    expectEqual(model.remove(size - 1), list.removeLast());
                }
                break;
            case REPLACE_AT:
                if (size == 0) {
                    expectError(ListError.INDEX_OUT_OF_RANGE, () -> list.replaceAt(value, 0));
                } else {
                    expectEqual(model.set(index, value), list.replaceAt(value, index));
                }
                break;
            case REVERSE:
                list.reverse();
                Collections.reverse(model);
                break;
            case SORT:
                list.sort(Comparator.naturalOrder());
                model.sort(Comparator.naturalOrder());
                break;
            case SPLICE_AFTER:
                final DoublyLinkedList<Integer> other = new DoublyLinkedList<>();
                for (int i = 0; i < request.getIndex() % 3; i++) {
                    other.addLast(value + i);
                }
                final List<Integer> added = Arrays.asList(other.toArray(Integer[]::new));
                if (size == 0) {
                    list.splice(other);
                    model.addAll(added);
                } else {
                    list.spliceAfter(other, index);
                    model.addAll(index + 1, added);
                }
                expectEqual(0, other.size());
                other.verifyIntegrity();
                break;
            case ITERATOR_REMOVE:
                final ForwardIterator<Integer> forward = list.forwardIterator();
                while (forward.hasNext()) {
                    if (forward.next() == value) {
                        expectEqual(true, forward.remove().isFound());
                        expectEqual(false, forward.remove().isFound());
                    }
                }
                model.removeIf(e -> e == value);
                break;
            case REVERSE_ITERATOR_ADD:
                final int steps = request.getIndex() % (size + 1);
                final ReverseIterator<Integer> reverse = list.reverseIterator();
                for (int i = 0; i < steps; i++) {
                    reverse.next();
                }
                reverse.add(value);
                expectEqual(size - steps, reverse.index());
                model.add(size - steps, value);
                break;
            default:
                throw new IllegalStateException("Unknown request type: " + request.getType());
        }
    }

    private static void expectError(ListError expected, Runnable operation) {
        try {
            operation.run();
        } catch (ListException e) {
            if (e.getError() != expected) {
                throw new IllegalStateException("Expected " + expected + " but got " + e.getError(), e);
            }
            return;
        }
        throw new IllegalStateException("Expected " + expected + " but the operation succeeded");
    }

    private static void expectEqual(Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            throw new IllegalStateException("Expected " + expected + " but got " + actual);
        }
    }
}
