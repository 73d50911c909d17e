package com.xcpradar.domain;

/**
 * Sink for freshly stored transactions. Implementations must not assume they are called on any particular thread.
 */
public interface TransactionNotifier {

    void publish(Transaction transaction);
}
