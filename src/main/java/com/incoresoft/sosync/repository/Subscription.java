package com.incoresoft.sosync.repository;

/**
 * Handle for a record subscription; closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
