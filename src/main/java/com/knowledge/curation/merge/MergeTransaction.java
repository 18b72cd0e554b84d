package com.knowledge.curation.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction over item mutations.
 * Each step registers an undo action; undo actions run in reverse order if a step fails
 * or the transaction closes without {@link #markSuccess()}.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     tx.execute("reject b", () -> mutate(b), () -> restore(bSnapshot));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Registers a step's compensation and runs the step. On failure every registered
     * compensation, including the failed step's own, runs and the exception is rethrown.
     * Compensations must therefore be safe to run against a partially applied step.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
        try {
            log.debug("Executing mutation step: {}", description);
            compensationStack.push(new CompensatingAction(description, compensation));
            operation.run();
        } catch (RuntimeException e) {
            log.warn("Mutation step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("MergeTransaction closed without success - running compensations");
            runCompensations();
        }
        closed = true;
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                // remaining compensations still run
                log.error("Compensation '{}' failed: {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
