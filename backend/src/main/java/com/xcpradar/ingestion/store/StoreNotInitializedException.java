package com.xcpradar.ingestion.store;

/**
 * Thrown by {@link TransactionStore} operations invoked before {@link TransactionStore#initialize()} completed.
 */
public class StoreNotInitializedException extends RuntimeException {

    public StoreNotInitializedException() {
        super("Transaction store not initialized; call initialize() first");
    }
}
