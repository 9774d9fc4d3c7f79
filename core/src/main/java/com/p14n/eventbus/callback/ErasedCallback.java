package com.p14n.eventbus.callback;

/**
 * Uniform invocation seam for callbacks of any message type.
 * The registration table stores only this interface; implementations restore
 * the payload's concrete type before calling application code.
 */
public interface ErasedCallback {

    /**
     * Invokes the callback with an erased payload.
     *
     * @param payload the message, which must be of the callback's type
     * @throws IllegalStateException if the payload has the wrong type
     */
    void invoke(Object payload);
}
