package com.dcruver.promptloom.domain;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class IndexProgressTest {

    @Test
    void testPercent() {
        assertEquals(0, new IndexProgress("Indexing tags", 5, 0).percent());
        assertEquals(33, new IndexProgress("Indexing tags", 1, 3).percent());
        assertEquals(100, new IndexProgress("Indexing tags", 3, 3).percent());
        assertEquals("Indexing tags (1/4, 25%)", new IndexProgress("Indexing tags", 1, 4).toString());
        assertEquals("Scanning library files...", new IndexProgress("Scanning library files", 0, 0).toString());
    }

    @Test
    void testCancellationSignal() {
        CancellationSignal signal = new CancellationSignal();
        signal.throwIfCancelled();

        signal.cancel();

        assertTrue(signal.isCancelled());
        assertThrows(CancellationException.class, signal::throwIfCancelled);
    }

    @Test
    void testNoneCannotBeCancelled() {
        CancellationSignal.none().cancel();

        assertFalse(CancellationSignal.none().isCancelled());
    }
}
