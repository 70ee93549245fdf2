package com.statecore.engine.lifecycle;

import com.statecore.engine.events.StateChangeStream;
import com.statecore.engine.service.TransactionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of the state core.
 *
 * On shutdown:
 * 1. Waits for in-flight transactions to finish (with timeout)
 * 2. Aborts the rest, releasing their locks
 * 3. Drains the change stream
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final long POLL_MILLIS = 100;

    private final TransactionService transactionService;
    private final StateChangeStream changeStream;
    private final Duration drainTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(TransactionService transactionService,
                                   StateChangeStream changeStream,
                                   Duration drainTimeout) {
        this.transactionService = transactionService;
        this.changeStream = changeStream;
        this.drainTimeout = drainTimeout;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown with {} active transactions",
            transactionService.activeTransactionCount());

        boolean drained = waitForTransactions();
        if (!drained) {
            int aborted = transactionService.abortAll("shutdown");
            log.warn("Aborted {} transactions still active after {} ms", aborted, drainTimeout.toMillis());
        }

        changeStream.close();
        log.info("Graceful shutdown complete");
    }

    private boolean waitForTransactions() {
        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (transactionService.activeTransactionCount() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while waiting for transactions");
                return false;
            }
        }
        return true;
    }
}
