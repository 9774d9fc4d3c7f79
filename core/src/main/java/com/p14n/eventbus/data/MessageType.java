package com.p14n.eventbus.data;

import com.google.common.reflect.TypeToken;

/**
 * Routing key identifying one message type on an event bus.
 * Wraps a Guava {@link TypeToken} so that parameterised types such as
 * {@code List<String>} and {@code List<Integer>} are distinct keys.
 *
 * <p>
 * Two keys built for the same type are always equal and share a hash code;
 * keys for different types never compare equal. Routing is by exact key, so a
 * key for a supertype does not match messages keyed by a subtype.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * MessageType<OrderPlaced> orders = MessageType.of(OrderPlaced.class);
 * MessageType<List<String>> names = MessageType.of(new TypeToken<List<String>>() {});
 * }</pre>
 *
 * @param <T> the message type this key identifies
 */
public final class MessageType<T> {

    private final TypeToken<T> token;

    private MessageType(TypeToken<T> token) {
        this.token = token;
    }

    /**
     * Returns the key for a plain message class. Primitive classes map to
     * their wrapper, so {@code int.class} and {@code Integer.class} are the
     * same key.
     *
     * @param type the message class
     * @param <T>  the message type
     * @return the key for {@code type}
     * @throws IllegalArgumentException if type is null
     */
    public static <T> MessageType<T> of(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        return new MessageType<>(TypeToken.of(type).wrap());
    }

    /**
     * Returns the key for a possibly parameterised message type. Primitive
     * types map to their wrapper.
     *
     * @param token the type token
     * @param <T>   the message type
     * @return the key for {@code token}
     * @throws IllegalArgumentException if token is null
     */
    public static <T> MessageType<T> of(TypeToken<T> token) {
        if (token == null) {
            throw new IllegalArgumentException("Type token cannot be null");
        }
        return new MessageType<>(token.wrap());
    }

    /**
     * Returns the key matching the runtime class of a message. Enum
     * constants key on their enum type, including constants with a body.
     *
     * @param message the message
     * @param <T>     the static message type
     * @return the key for the message's class
     * @throws IllegalArgumentException if message is null
     */
    public static <T> MessageType<T> ofInstance(T message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        Class<?> runtime = message instanceof Enum<?> e ? e.getDeclaringClass() : message.getClass();
        @SuppressWarnings("unchecked")
        Class<T> type = (Class<T>) runtime;
        return of(type);
    }

    /**
     * Restores an erased payload to this key's type.
     *
     * @param payload the erased payload
     * @return the payload viewed as {@code T}
     * @throws IllegalStateException if the payload is not an instance of this
     *                               type, which means the routing table was
     *                               bypassed
     */
    public T cast(Object payload) {
        Class<? super T> raw = token.getRawType();
        if (!raw.isInstance(payload)) {
            throw new IllegalStateException("Payload of type "
                    + (payload == null ? "null" : payload.getClass().getName())
                    + " routed to callback for " + this);
        }
        @SuppressWarnings("unchecked")
        T typed = (T) payload;
        return typed;
    }

    /**
     * Returns the underlying type token.
     *
     * @return the type token
     */
    public TypeToken<T> token() {
        return token;
    }

    /**
     * Returns a short name suitable for metric attributes and log lines.
     *
     * @return the type's name
     */
    public String name() {
        return token.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MessageType)) {
            return false;
        }
        return token.equals(((MessageType<?>) o).token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return "MessageType[" + name() + "]";
    }
}
