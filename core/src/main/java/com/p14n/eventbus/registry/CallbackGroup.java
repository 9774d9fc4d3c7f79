package com.p14n.eventbus.registry;

import com.p14n.eventbus.callback.ErasedCallback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Callbacks one listener registered for one message type, in registration
 * order.
 */
public final class CallbackGroup {

    private final int listenerId;
    private final List<ErasedCallback> callbacks = new ArrayList<>();

    CallbackGroup(int listenerId) {
        this.listenerId = listenerId;
    }

    void add(ErasedCallback callback) {
        callbacks.add(callback);
    }

    /**
     * Returns the id of the listener owning this group.
     *
     * @return the listener id
     */
    public int listenerId() {
        return listenerId;
    }

    /**
     * Returns a read-only view of the callbacks.
     *
     * @return the callbacks in registration order
     */
    public List<ErasedCallback> callbacks() {
        return Collections.unmodifiableList(callbacks);
    }

    boolean isEmpty() {
        return callbacks.isEmpty();
    }
}
