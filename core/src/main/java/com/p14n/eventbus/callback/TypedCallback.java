package com.p14n.eventbus.callback;

import com.p14n.eventbus.data.MessageType;

/**
 * Adapts a typed {@link MessageCallback} to the {@link ErasedCallback} seam.
 *
 * @param <T> the message type
 */
public final class TypedCallback<T> implements ErasedCallback {

    private final MessageType<T> type;
    private final MessageCallback<? super T> callback;

    /**
     * Wraps a callback for the given type.
     *
     * @param type     the type the callback is registered under
     * @param callback the application callback
     * @throws IllegalArgumentException if either argument is null
     */
    public TypedCallback(MessageType<T> type, MessageCallback<? super T> callback) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("Callback cannot be null");
        }
        this.type = type;
        this.callback = callback;
    }

    @Override
    public void invoke(Object payload) {
        callback.onMessage(type.cast(payload));
    }

    /**
     * Returns the type this callback was registered under.
     *
     * @return the message type
     */
    public MessageType<T> type() {
        return type;
    }
}
