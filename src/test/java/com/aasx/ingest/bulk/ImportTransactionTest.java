package com.aasx.ingest.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportTransactionTest {

    private final List<String> log = new ArrayList<>();

    @Test
    @DisplayName("Committed transaction keeps its writes")
    void commitKeepsWrites() {
        try (ImportTransaction tx = new ImportTransaction("batch")) {
            tx.execute("a", () -> log.add("write a"), () -> log.add("undo a"));
            tx.execute("b", () -> log.add("write b"), () -> log.add("undo b"));
            tx.commit();
            assertEquals(2, tx.writes());
            assertTrue(tx.isCommitted());
        }
        assertEquals(List.of("write a", "write b"), log);
    }

    @Test
    @DisplayName("Closing without commit undoes writes newest first")
    void closeWithoutCommitRollsBack() {
        ImportTransaction tx = new ImportTransaction("batch");
        tx.execute("a", () -> log.add("write a"), () -> log.add("undo a"));
        tx.execute("b", () -> log.add("write b"), () -> log.add("undo b"));
        tx.close();

        assertEquals(List.of("write a", "write b", "undo b", "undo a"), log);
        assertEquals(2, tx.rolledBack());
    }

    @Test
    @DisplayName("A failing write undoes earlier writes and rethrows")
    void failingWrite() {
        ImportTransaction tx = new ImportTransaction("batch");
        tx.execute("a", () -> log.add("write a"), () -> log.add("undo a"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> tx.execute("b", () -> {
                    throw new IllegalStateException("boom");
                }, () -> log.add("undo b")));

        assertEquals("boom", e.getMessage());
        assertEquals(List.of("write a", "undo a"), log);
        tx.close();
        assertEquals(List.of("write a", "undo a"), log);
    }

    @Test
    @DisplayName("A failing undo does not stop the remaining undos and is reported")
    void failingUndoContinues() {
        ImportTransaction tx = new ImportTransaction("batch");
        tx.execute("a", () -> log.add("write a"), () -> log.add("undo a"));
        tx.execute("b", () -> log.add("write b"), () -> {
            throw new IllegalStateException("undo failed");
        });

        PartialImportException e = assertThrows(PartialImportException.class, tx::close);

        assertEquals(List.of("write a", "write b", "undo a"), log);
        assertEquals(1, tx.rolledBack());
        assertEquals(List.of("b"), e.getFailedUndoSteps());
        assertNull(e.getCause());
        assertEquals("undo failed", e.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("A failing write whose undo also fails carries the write error as cause")
    void failingWriteAndUndo() {
        ImportTransaction tx = new ImportTransaction("batch");
        tx.execute("a", () -> log.add("write a"), () -> {
            throw new IllegalStateException("connection lost");
        });
        tx.execute("b", () -> log.add("write b"), () -> log.add("undo b"));

        PartialImportException e = assertThrows(PartialImportException.class,
                () -> tx.execute("c", () -> {
                    throw new IllegalStateException("connection lost");
                }, () -> log.add("undo c")));

        assertEquals("connection lost", e.getCause().getMessage());
        assertEquals(List.of("a"), e.getFailedUndoSteps());
        assertEquals(1, e.getSuppressed().length);
        assertEquals(List.of("write a", "write b", "undo b"), log);
        tx.close();
    }

    @Test
    void executeAfterCloseFails() {
        ImportTransaction tx = new ImportTransaction("batch");
        tx.close();
        assertThrows(IllegalStateException.class, () -> tx.execute("a", () -> { }, () -> { }));
    }
}
