package com.analysiswatch.core.events;

/**
 * Handle for cancelling a subscription. Calling {@link #unsubscribe()} more than once is harmless.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
