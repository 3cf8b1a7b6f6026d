package tester.models;

public enum RType {
    ADD_FIRST,
    ADD_LAST,
    ADD_AT,
    REMOVE_AT,
    REMOVE,
    REMOVE_FIRST,
    REMOVE_LAST,
    REPLACE_AT,
    REVERSE,
    SORT,
    SPLICE_AFTER,
    ITERATOR_REMOVE,
    REVERSE_ITERATOR_ADD
}
