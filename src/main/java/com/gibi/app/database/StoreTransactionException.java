package com.gibi.app.database;

/**
 * Commit no índice falhou mesmo após o retry imediato.
 */
public class StoreTransactionException extends RuntimeException {

    private final String operation;

    public StoreTransactionException(String operation, Throwable cause) {
        super("Transação '" + operation + "' falhou: " + (cause == null ? "?" : cause.getMessage()), cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
