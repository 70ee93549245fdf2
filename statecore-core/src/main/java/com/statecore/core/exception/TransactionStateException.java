package com.statecore.core.exception;

import java.util.UUID;

/**
 * Thrown when a transaction handle is used after it has finished.
 */
public class TransactionStateException extends StateCoreException {

    public static final String ERROR_CODE = "INVALID_TRANSACTION_STATE";

    public TransactionStateException(UUID transactionId, String currentState, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s transaction %s in state %s",
            operation, transactionId, currentState
        ));
    }

    public TransactionStateException(String message) {
        super(ERROR_CODE, message);
    }
}
