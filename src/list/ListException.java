package list;

public class ListException extends RuntimeException {
    private final ListError error;

    public ListException(ListError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public ListException(ListError error, String message, Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public ListError getError() {
        return error;
    }

    public static ListException indexOutOfRange(int index, int size) {
        return new ListException(ListError.INDEX_OUT_OF_RANGE, "index " + index + " outside [0, " + size + ")");
    }

    public static ListException empty(String operation) {
        return new ListException(ListError.EMPTY_COLLECTION, operation + " on an empty list");
    }
}
