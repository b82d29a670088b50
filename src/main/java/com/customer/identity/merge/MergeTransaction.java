package com.customer.identity.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * All-or-nothing merge for stores without native transactions, such as the in-memory store.
 * Each step registers an undo action. If a step throws, or the transaction closes without
 * {@link #markSuccess()}, the undo actions run newest first.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction("merge 42")) {
 *     tx.execute("repoint orders", () -> repoint(...), () -> restore(...));
 *     tx.execute("delete merged customers", () -> delete(...), () -> reinsert(...));
 *     tx.markSuccess();
 * }
 * </pre>
 *
 * <p>An undo action that throws does not stop the others; its step is reported by
 * {@link #failedCompensations()} because the store may then hold a partial merge.</p>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final String label;
    private final Deque<Step> undoStack = new ArrayDeque<>();
    private final List<String> failedCompensations = new ArrayList<>();
    private boolean success = false;
    private boolean closed = false;

    public MergeTransaction() {
        this("merge");
    }

    public MergeTransaction(String label) {
        this.label = label;
    }

    /**
     * Runs {@code operation} and remembers {@code compensation} for rollback.
     * When the operation throws, earlier steps are undone and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction '" + label + "' is already closed");
        }

        log.debug("merge.step tx={} step={}", label, description);
        try {
            operation.run();
        } catch (RuntimeException e) {
            log.warn("merge.step_failed tx={} step={} error={}", label, description, e.getMessage());
            rollback();
            throw e;
        }
        undoStack.push(new Step(description, compensation));
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of steps that would be undone on rollback.
     */
    public int pendingCompensations() {
        return undoStack.size();
    }

    public List<String> failedCompensations() {
        return List.copyOf(failedCompensations);
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("merge.rollback tx={} steps={}", label, undoStack.size());
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        while (!undoStack.isEmpty()) {
            Step step = undoStack.pop();
            try {
                step.compensation().run();
            } catch (RuntimeException e) {
                failedCompensations.add(step.description());
                log.error("merge.compensation_failed tx={} step={} error={}", label, step.description(),
                        e.getMessage());
            }
        }
    }

    private record Step(String description, Runnable compensation) {}
}
