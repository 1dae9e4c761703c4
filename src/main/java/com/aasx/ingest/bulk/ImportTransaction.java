package com.aasx.ingest.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups the writes of one batch file. Every write registers an undo action; when a
 * write fails, or the transaction closes without {@link #commit()}, the undo actions
 * run newest first so the file leaves nothing partial behind. If an undo action fails
 * too, the remaining ones still run and a {@link PartialImportException} reports which
 * writes may be left in the store.
 *
 * <pre>
 * try (ImportTransaction tx = new ImportTransaction("motor_graph.json")) {
 *     tx.execute("create node urn:ex:1", () -> upsert(node), () -> delete(node));
 *     tx.commit();
 * }
 * </pre>
 */
public class ImportTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ImportTransaction.class);

    private final String name;
    private final Deque<UndoAction> undoStack = new ArrayDeque<>();
    private boolean committed = false;
    private boolean closed = false;
    private int rolledBack = 0;

    public ImportTransaction(String name) {
        this.name = name;
    }

    /**
     * Runs a write and registers its undo action. If the write throws, everything
     * registered so far is undone and the exception is rethrown.
     *
     * @throws PartialImportException if the write failed and an undo action failed as well
     */
    public void execute(String description, Runnable write, Runnable undo) {
        if (closed) {
            throw new IllegalStateException("Import transaction " + name + " is already closed");
        }
        try {
            write.run();
            undoStack.push(new UndoAction(description, undo));
        } catch (RuntimeException e) {
            log.warn("import.writeFailed batch={} step='{}' error={}", name, description, e.getMessage());
            closed = true;
            List<FailedUndo> failedUndos = rollback();
            if (!failedUndos.isEmpty()) {
                throw partial(failedUndos, e);
            }
            throw e;
        }
    }

    public void commit() {
        this.committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    public int writes() {
        return undoStack.size();
    }

    /**
     * Number of undo actions run so far.
     */
    public int rolledBack() {
        return rolledBack;
    }

    /**
     * Undoes every write unless the transaction was committed.
     *
     * @throws PartialImportException if an undo action failed
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed) {
            log.warn("import.rollback batch={} writes={}", name, undoStack.size());
            List<FailedUndo> failedUndos = rollback();
            if (!failedUndos.isEmpty()) {
                throw partial(failedUndos, null);
            }
        }
    }

    private List<FailedUndo> rollback() {
        List<FailedUndo> failed = new ArrayList<>();
        while (!undoStack.isEmpty()) {
            UndoAction action = undoStack.pop();
            try {
                action.undo.run();
                rolledBack++;
            } catch (RuntimeException e) {
                log.error("import.undoFailed batch={} step='{}' error={}", name, action.description, e.getMessage());
                failed.add(new FailedUndo(action.description, e));
            }
        }
        return failed;
    }

    private PartialImportException partial(List<FailedUndo> failedUndos, Throwable cause) {
        PartialImportException exception = new PartialImportException(name,
                failedUndos.stream().map(FailedUndo::description).toList(), cause);
        failedUndos.forEach(failed -> exception.addSuppressed(failed.error()));
        return exception;
    }

    private record UndoAction(String description, Runnable undo) {}

    private record FailedUndo(String description, RuntimeException error) {}
}
