package com.p14n.eventbus.telemetry;

import com.p14n.eventbus.data.MessageType;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for event bus operations.
 * Every measurement carries a {@code message_type} attribute.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>messages_dispatched: Counter for messages fanned out, whether directly
 * or while processing the queue</li>
 * <li>messages_posted: Counter for messages queued for later processing</li>
 * <li>callbacks_invoked: Counter for callback invocations that returned
 * normally</li>
 * <li>active_listeners: Up/down counter for listener groups registered per
 * type</li>
 * </ul>
 */
public class BusMetrics {

        /** Attribute key naming the routed message type. */
        public static final AttributeKey<String> MESSAGE_TYPE = AttributeKey.stringKey("message_type");

        private final LongCounter dispatchedMessages;
        private final LongCounter postedMessages;
        private final LongCounter invokedCallbacks;
        private final LongUpDownCounter activeListeners;

        /**
         * Creates a new BusMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BusMetrics(Meter meter) {
                dispatchedMessages = meter.counterBuilder("messages_dispatched")
                                .setDescription("Number of messages dispatched to listeners")
                                .build();

                postedMessages = meter.counterBuilder("messages_posted")
                                .setDescription("Number of messages queued for processing")
                                .build();

                invokedCallbacks = meter.counterBuilder("callbacks_invoked")
                                .setDescription("Number of callbacks that handled a message")
                                .build();

                activeListeners = meter.upDownCounterBuilder("active_listeners")
                                .setDescription("Number of listener groups registered")
                                .build();
        }

        public void recordDispatched(MessageType<?> type) {
                dispatchedMessages.add(1, attributes(type));
        }

        public void recordPosted(MessageType<?> type) {
                postedMessages.add(1, attributes(type));
        }

        public void recordInvoked(MessageType<?> type) {
                invokedCallbacks.add(1, attributes(type));
        }

        public void recordListenerAdded(MessageType<?> type) {
                activeListeners.add(1, attributes(type));
        }

        public void recordListenerRemoved(MessageType<?> type) {
                activeListeners.add(-1, attributes(type));
        }

        private static Attributes attributes(MessageType<?> type) {
                return Attributes.of(MESSAGE_TYPE, type.name());
        }
}
