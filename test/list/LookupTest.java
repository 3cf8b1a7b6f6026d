package list;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LookupTest {

    @Test
    void foundNullIsNotAbsence() {
        final Lookup<String> foundNull = Lookup.found(null);
        assertTrue(foundNull.isFound());
        assertNull(foundNull.get());
        assertNotEquals(Lookup.<String>notFound(), foundNull);
        assertEquals("x", Lookup.<String>notFound().orElse("x"));
        assertNull(foundNull.orElse("x"));
    }

    @Test
    void getOnNotFoundThrows() {
        final ListException e = assertThrows(ListException.class, () -> Lookup.notFound().get());
        assertEquals(ListError.NOT_FOUND, e.getError());
    }

    @Test
    void exceptionMessageCarriesKind() {
        final ListException e = ListException.indexOutOfRange(3, 2);
        assertEquals(ListError.INDEX_OUT_OF_RANGE, e.getError());
        assertTrue(e.getMessage().startsWith("INDEX_OUT_OF_RANGE"));
        assertEquals(ListError.EMPTY_COLLECTION, ListException.empty("getFirst").getError());
    }
}
