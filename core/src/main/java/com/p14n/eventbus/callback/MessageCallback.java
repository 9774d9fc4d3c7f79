package com.p14n.eventbus.callback;

/**
 * Application callback receiving messages of one type.
 *
 * @param <T> The type of messages this callback handles
 */
@FunctionalInterface
public interface MessageCallback<T> {

    /**
     * Called for each message dispatched under the registered type.
     * Exceptions thrown here propagate to the caller of the dispatch.
     *
     * @param message The message
     */
    void onMessage(T message);
}
