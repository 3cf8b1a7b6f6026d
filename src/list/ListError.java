package list;

public enum ListError {
    INDEX_OUT_OF_RANGE,
    EMPTY_COLLECTION,
    INVALID_ARGUMENT,
    ALLOCATION_FAILURE,
    NOT_FOUND
}
