package com.p14n.eventbus.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Utility class running bus work inside OpenTelemetry spans.
 * Exceptions thrown by the wrapped action are recorded on the span and
 * rethrown unchanged.
 */
public class OpenTelemetryFunctions {

        /** Private constructor to prevent instantiation of utility class */
        private OpenTelemetryFunctions() {
        }

        /**
         * Executes an action within a new trace span.
         *
         * @param <T>      Return type of the action
         * @param tracer   Tracer to create spans
         * @param spanName Name of the span to create
         * @param action   Action to execute within the span
         * @return Result of the action execution
         * @throws RuntimeException if the action throws an exception
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(tracer.spanBuilder(spanName), action);
        }

        /**
         * Executes an action within a new trace span tagged with the routed
         * message type.
         *
         * @param <T>         Return type of the action
         * @param tracer      Tracer to create spans
         * @param spanName    Name of the span to create
         * @param messageType Message type attribute for the span
         * @param action      Action to execute within the span
         * @return Result of the action execution
         * @throws RuntimeException if the action throws an exception
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String messageType,
                        Supplier<T> action) {
                return processWithTelemetry(tracer.spanBuilder(spanName)
                                .setAttribute(BusMetrics.MESSAGE_TYPE, messageType), action);
        }

        private static <T> T processWithTelemetry(SpanBuilder sb, Supplier<T> action) {
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
