package list;

import java.util.Objects;

/**
 * Outcome of a search-style operation. Unlike a plain nullable return, a found
 * {@code null} payload and a missing element are told apart.
 */
public final class Lookup<T> {
    private static final Lookup<?> NOT_FOUND = new Lookup<>(false, null);

    private final boolean found;
    private final T value;

    private Lookup(boolean found, T value) {
        this.found = found;
        this.value = value;
    }

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(true, value);
    }

    @SuppressWarnings("unchecked")
    public static <T> Lookup<T> notFound() {
        return (Lookup<T>) NOT_FOUND;
    }

    public boolean isFound() {
        return found;
    }

    public T get() {
        if (!found) {
            throw new ListException(ListError.NOT_FOUND, "no value present");
        }
        return value;
    }

    public T orElse(T other) {
        return found ? value : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lookup)) return false;
        final Lookup<?> lookup = (Lookup<?>) o;
        return found == lookup.found && Objects.equals(value, lookup.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(found, value);
    }

    @Override
    public String toString() {
        return found ? "Found{" + value + '}' : "NotFound";
    }
}
