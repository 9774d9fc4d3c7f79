package com.p14n.eventbus.data;

/**
 * A message queued by {@code post} and waiting for {@code process}.
 * The payload is held erased; {@code type} is the only route back to its
 * concrete type.
 *
 * @param type    the routing key the message was posted under
 * @param payload the erased message
 */
public record PendingMessage(MessageType<?> type, Object payload) {

    /**
     * Creates a pending message.
     *
     * @param type    the routing key
     * @param payload the erased message
     * @throws IllegalArgumentException if either argument is null
     */
    public PendingMessage {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
    }
}
