package com.statecore.engine.logging;

import com.statecore.core.model.AccessMode;
import com.statecore.core.model.EntityKey;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTransaction(txId, mode, actor)) {
 *     log.info("Committing"); // includes transactionId, accessMode, actor
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TRANSACTION_ID = "transactionId";
    public static final String ACCESS_MODE = "accessMode";
    public static final String ACTOR = "actor";
    public static final String ENTITY_TYPE = "entityType";
    public static final String ENTITY_ID = "entityId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for transaction-level operations.
     */
    public static LoggingContext forTransaction(UUID transactionId, AccessMode mode, String actor) {
        LoggingContext ctx = new LoggingContext();
        if (transactionId != null) {
            MDC.put(TRANSACTION_ID, transactionId.toString());
        }
        if (mode != null) {
            MDC.put(ACCESS_MODE, mode.name());
        }
        if (actor != null) {
            MDC.put(ACTOR, actor);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for single-entity operations.
     */
    public static LoggingContext forEntity(EntityKey key, String actor) {
        LoggingContext ctx = new LoggingContext();
        if (key != null) {
            MDC.put(ENTITY_TYPE, key.entityType().code());
            MDC.put(ENTITY_ID, key.entityId());
        }
        if (actor != null) {
            MDC.put(ACTOR, actor);
        }
        ensureTraceId();
        return ctx;
    }

    public static String getTransactionId() {
        return MDC.get(TRANSACTION_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TRANSACTION_ID);
        MDC.remove(ACCESS_MODE);
        MDC.remove(ACTOR);
        MDC.remove(ENTITY_TYPE);
        MDC.remove(ENTITY_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
