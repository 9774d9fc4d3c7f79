package com.p14n.eventbus.bus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventbus.callback.MessageCallback;
import com.p14n.eventbus.callback.TypedCallback;
import com.p14n.eventbus.data.EventBusConfig;
import com.p14n.eventbus.data.MessageType;
import com.p14n.eventbus.data.PendingMessage;
import com.p14n.eventbus.data.ProcessPolicy;
import com.p14n.eventbus.registry.RegistrationTable;
import com.p14n.eventbus.telemetry.BusMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * In-process publish/subscribe registry routing messages by type.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Synchronous fan-out with {@link #immediate(Object)}</li>
 * <li>Deferred batching with {@link #post(Object)} and {@link #process()}</li>
 * <li>Scoped registrations through {@link Listener} handles, removed in full
 * when a listener is closed</li>
 * <li>OpenTelemetry metrics and tracing</li>
 * </ul>
 *
 * <p>
 * The bus is not thread-safe and holds no locks. Callers confine it to one
 * thread or synchronize externally. Callbacks may call back into the bus
 * while a dispatch is running: each fan-out iterates over a snapshot of the
 * callbacks registered when it started, so registrations added or removed by
 * a callback take effect from the next dispatch.
 * </p>
 *
 * <p>
 * Exceptions thrown by callbacks are not caught. They propagate to whoever
 * called {@code immediate} or {@code process}, and the remaining callbacks of
 * that fan-out do not run.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventBus bus = new EventBus();
 * try (Listener listener = new Listener(bus)) {
 *     listener.listen(OrderPlaced.class, order -> ship(order));
 *     bus.immediate(new OrderPlaced("o-1"));
 *     bus.post(new OrderPlaced("o-2"));
 *     bus.process();
 * }
 * }</pre>
 */
public class EventBus implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final RegistrationTable table = new RegistrationTable();
    private final Deque<PendingMessage> pending = new ArrayDeque<>();
    private final EventBusConfig config;
    private final BusMetrics metrics;
    private final Tracer tracer;

    private int lastListenerId = 0;
    private boolean closed = false;

    /**
     * Creates a bus with default configuration and no-op telemetry.
     */
    public EventBus() {
        this(OpenTelemetry.noop(), EventBusConfig.defaults());
    }

    /**
     * Creates a bus with the given configuration and no-op telemetry.
     *
     * @param config the bus configuration
     */
    public EventBus(EventBusConfig config) {
        this(OpenTelemetry.noop(), config);
    }

    /**
     * Creates a bus reporting to the given OpenTelemetry instance.
     *
     * @param ot     The OpenTelemetry instance for metrics and tracing
     * @param config the bus configuration
     * @throws IllegalArgumentException if either argument is null
     */
    public EventBus(OpenTelemetry ot, EventBusConfig config) {
        if (ot == null) {
            throw new IllegalArgumentException("OpenTelemetry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
        this.metrics = new BusMetrics(ot.getMeter(config.scopeName()));
        this.tracer = ot.getTracer(config.scopeName());
    }

    /**
     * Delivers a message to every callback registered for its runtime class,
     * before returning.
     *
     * @param message the message
     * @param <T>     the message type
     * @throws IllegalStateException    if the bus is closed
     * @throws IllegalArgumentException if message is null
     */
    public <T> void immediate(T message) {
        immediate(MessageType.ofInstance(message), message);
    }

    /**
     * Delivers a message to every callback registered for {@code type}.
     *
     * @param type    the type to route under
     * @param message the message
     * @param <T>     the message type
     */
    public <T> void immediate(Class<T> type, T message) {
        immediate(MessageType.of(type), message);
    }

    /**
     * Delivers a message to every callback registered for {@code type}, in
     * listener registration order. Does nothing if no callback is registered.
     *
     * @param type    the type to route under
     * @param message the message
     * @param <T>     the message type
     * @throws IllegalStateException    if the bus is closed
     * @throws IllegalArgumentException if an argument is null or the message is
     *                                  not an instance of {@code type}
     */
    public <T> void immediate(MessageType<T> type, T message) {
        checkMessage(type, message);
        dispatch(type, message);
    }

    /**
     * Queues a message, routed by its runtime class, for the next
     * {@link #process()}.
     *
     * @param message the message
     * @param <T>     the message type
     * @throws IllegalStateException    if the bus is closed
     * @throws IllegalArgumentException if message is null
     */
    public <T> void post(T message) {
        post(MessageType.ofInstance(message), message);
    }

    /**
     * Queues a message under {@code type} for the next {@link #process()}.
     *
     * @param type    the type to route under
     * @param message the message
     * @param <T>     the message type
     */
    public <T> void post(Class<T> type, T message) {
        post(MessageType.of(type), message);
    }

    /**
     * Queues a message under {@code type} for the next {@link #process()}.
     * Nothing is dispatched until then.
     *
     * @param type    the type to route under
     * @param message the message
     * @param <T>     the message type
     * @throws IllegalStateException    if the bus is closed
     * @throws IllegalArgumentException if an argument is null or the message is
     *                                  not an instance of {@code type}
     */
    public <T> void post(MessageType<T> type, T message) {
        checkMessage(type, message);
        pending.add(new PendingMessage(type, message));
        metrics.recordPosted(type);
    }

    /**
     * Dispatches queued messages in the order they were posted.
     * Each message leaves the queue before it is dispatched, so if a callback
     * throws, the messages behind it stay queued.
     *
     * <p>
     * With {@link ProcessPolicy#DRAIN_UNTIL_EMPTY} messages posted by callbacks
     * during this call are delivered by it too. With
     * {@link ProcessPolicy#SNAPSHOT} only the messages queued on entry are
     * delivered.
     * </p>
     *
     * @return the number of messages dispatched
     * @throws IllegalStateException if the bus is closed
     */
    public int process() {
        checkOpen();
        return processWithTelemetry(tracer, "process_pending", () -> {
            int limit = config.processPolicy() == ProcessPolicy.SNAPSHOT ? pending.size() : Integer.MAX_VALUE;
            int processed = 0;
            while (processed < limit && !pending.isEmpty()) {
                PendingMessage next = pending.poll();
                processed++;
                dispatch(next.type(), next.payload());
            }
            logger.atDebug().log("Processed {} pending messages, {} left queued", processed, pending.size());
            return processed;
        });
    }

    /**
     * Returns the number of messages waiting for {@link #process()}.
     *
     * @return the queue length
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Returns whether any callback is registered for a class.
     *
     * @param type the message class
     * @return true if at least one listener is registered
     */
    public boolean hasListeners(Class<?> type) {
        return hasListeners(MessageType.of(type));
    }

    /**
     * Returns whether any callback is registered for a type.
     *
     * @param type the message type
     * @return true if at least one listener is registered
     */
    public boolean hasListeners(MessageType<?> type) {
        return table.contains(type);
    }

    /**
     * Returns the number of listeners with at least one callback for a type.
     *
     * @param type the message type
     * @return the listener count
     */
    public int listenerCount(MessageType<?> type) {
        return table.groups(type).size();
    }

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return true once the bus is closed
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the bus, dropping every registration and queued message.
     * Afterwards dispatching, posting, processing and registering fail, while
     * removals stay silent no-ops.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int dropped = pending.size();
        pending.clear();
        table.clear();
        logger.atInfo().log("Event bus closed, dropped {} pending messages", dropped);
    }

    int nextListenerId() {
        checkOpen();
        return ++lastListenerId;
    }

    <T> void addListener(MessageType<T> type, int listenerId, MessageCallback<? super T> callback) {
        checkOpen();
        if (table.add(type, listenerId, new TypedCallback<>(type, callback))) {
            metrics.recordListenerAdded(type);
        }
        logger.atDebug().log("Listener {} registered callback for {}", listenerId, type);
    }

    void removeListener(MessageType<?> type, int listenerId) {
        if (closed) {
            return;
        }
        if (table.remove(type, listenerId)) {
            metrics.recordListenerRemoved(type);
            logger.atDebug().log("Listener {} unregistered from {}", listenerId, type);
        }
    }

    void removeListener(int listenerId) {
        if (closed) {
            return;
        }
        List<MessageType<?>> removedFrom = table.removeListener(listenerId);
        for (MessageType<?> type : removedFrom) {
            metrics.recordListenerRemoved(type);
        }
        logger.atDebug().log("Listener {} unregistered from {} types", listenerId, removedFrom.size());
    }

    private void dispatch(MessageType<?> type, Object payload) {
        if (!table.contains(type)) {
            logger.atDebug().log("No listeners for {}", type);
            return;
        }
        metrics.recordDispatched(type);
        processWithTelemetry(tracer, "dispatch_message", type.name(), () -> {
            table.forEach(type, callback -> {
                callback.invoke(payload);
                metrics.recordInvoked(type);
            });
            return null;
        });
    }

    private void checkMessage(MessageType<?> type, Object message) {
        checkOpen();
        if (type == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (!type.token().getRawType().isInstance(message)) {
            throw new IllegalArgumentException("Message of type " + message.getClass().getName()
                    + " is not an instance of " + type);
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Event bus is closed");
        }
    }
}
