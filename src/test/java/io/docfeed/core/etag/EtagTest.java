package io.docfeed.core.etag;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EtagTest {

    @Test
    void ordersByValue() {
        assertTrue(Etag.of(5).isAfter(Etag.of(4)));
        assertFalse(Etag.of(4).isAfter(Etag.of(4)));
        assertTrue(Etag.ZERO.compareTo(Etag.of(1)) < 0);
        assertEquals(Etag.of(9), Etag.max(Etag.of(9), Etag.of(3)));
        assertEquals(Etag.of(9), Etag.max(Etag.of(3), Etag.of(9)));
    }

    @Test
    void zeroIsShared() {
        assertSame(Etag.ZERO, Etag.of(0));
    }

    @Test
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Etag.of(-1));
    }
}
