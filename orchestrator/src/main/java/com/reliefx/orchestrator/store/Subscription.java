package com.reliefx.orchestrator.store;

/**
 * Handle returned by {@link StateStore#subscribe}. Closing it stops delivery.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
