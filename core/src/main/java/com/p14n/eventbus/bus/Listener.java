package com.p14n.eventbus.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbus.callback.MessageCallback;
import com.p14n.eventbus.data.MessageType;

/**
 * Scoped handle grouping callback registrations on an {@link EventBus}.
 *
 * <p>
 * Each listener gets a fresh id from its bus on construction. Closing the
 * listener removes every callback it registered, for every type, and is
 * final: a closed listener drops its bus, after which {@code listen} is
 * silently ignored and the removal methods do nothing. Use it in a
 * try-with-resources block so registrations are released on every exit path.
 * </p>
 *
 * <pre>{@code
 * try (Listener listener = new Listener(bus)) {
 *     listener.listen(Tick.class, tick -> counter.increment());
 *     bus.immediate(new Tick());
 * }
 * }</pre>
 */
public class Listener implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Listener.class);

    private final int id;
    private EventBus bus;

    /**
     * Creates a listener bound to a bus.
     *
     * @param bus the bus to register with
     * @throws IllegalArgumentException if bus is null
     * @throws IllegalStateException    if the bus is closed
     */
    public Listener(EventBus bus) {
        if (bus == null) {
            throw new IllegalArgumentException("Bus cannot be null");
        }
        this.bus = bus;
        this.id = bus.nextListenerId();
        logger.atDebug().log("Listener {} created", id);
    }

    /**
     * Registers a callback for messages of the given class.
     *
     * @param type     the message class
     * @param callback the callback
     * @param <T>      the message type
     */
    public <T> void listen(Class<T> type, MessageCallback<? super T> callback) {
        listen(MessageType.of(type), callback);
    }

    /**
     * Registers a callback for messages of the given type. Repeated calls for
     * the same type add further callbacks, invoked in registration order.
     * Ignored once the listener is closed.
     *
     * @param type     the message type
     * @param callback the callback
     * @param <T>      the message type
     * @throws IllegalArgumentException if an argument is null
     * @throws IllegalStateException    if the bus is closed
     */
    public <T> void listen(MessageType<T> type, MessageCallback<? super T> callback) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("Callback cannot be null");
        }
        if (bus == null) {
            return;
        }
        bus.addListener(type, id, callback);
    }

    /**
     * Removes this listener's callbacks for one class.
     *
     * @param type the message class
     */
    public void unlisten(Class<?> type) {
        unlisten(MessageType.of(type));
    }

    /**
     * Removes this listener's callbacks for one type, leaving its other
     * registrations in place.
     *
     * @param type the message type
     */
    public void unlisten(MessageType<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (bus != null) {
            bus.removeListener(type, id);
        }
    }

    /**
     * Removes every callback this listener registered and closes it.
     * Safe to call any number of times.
     */
    public void unlistenAll() {
        if (bus == null) {
            return;
        }
        bus.removeListener(id);
        bus = null;
        logger.atDebug().log("Listener {} disposed", id);
    }

    @Override
    public void close() {
        unlistenAll();
    }

    /**
     * Returns the id assigned by the bus.
     *
     * @return the listener id, never zero
     */
    public int id() {
        return id;
    }

    /**
     * Returns whether the listener is still bound to its bus.
     *
     * @return false once disposed
     */
    public boolean isActive() {
        return bus != null;
    }
}
