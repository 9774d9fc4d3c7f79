package com.p14n.eventbus.bus;

import com.p14n.eventbus.data.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class ListenerTest {

    static final class Ping {
    }

    static final class Pong {
    }

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void shouldAssignIncreasingIdsStartingAtOne() {
        Listener first = new Listener(bus);
        Listener second = new Listener(bus);
        first.close();
        Listener third = new Listener(bus);

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertEquals(3, third.id());
    }

    @Test
    void shouldStopReceivingAfterClose() {
        AtomicInteger pings = new AtomicInteger();
        AtomicInteger pongs = new AtomicInteger();
        Listener listener = new Listener(bus);
        listener.listen(Ping.class, p -> pings.incrementAndGet());
        listener.listen(Pong.class, p -> pongs.incrementAndGet());
        bus.post(new Ping());

        listener.close();

        bus.immediate(new Ping());
        bus.immediate(new Pong());
        bus.process();
        assertEquals(0, pings.get());
        assertEquals(0, pongs.get());
        assertFalse(bus.hasListeners(Ping.class));
        assertFalse(bus.hasListeners(Pong.class));
    }

    @Test
    void shouldUnregisterOnEveryExitPathOfTryWithResources() {
        AtomicInteger count = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> {
            try (Listener listener = new Listener(bus)) {
                listener.listen(Ping.class, p -> count.incrementAndGet());
                bus.immediate(new Ping());
                throw new IllegalStateException("leaving scope early");
            }
        });

        bus.immediate(new Ping());
        assertEquals(1, count.get());
        assertFalse(bus.hasListeners(Ping.class));
    }

    @Test
    void shouldUnlistenOnlyOneType() {
        AtomicInteger pings = new AtomicInteger();
        AtomicInteger pongs = new AtomicInteger();
        Listener listener = new Listener(bus);
        listener.listen(Ping.class, p -> pings.incrementAndGet());
        listener.listen(Ping.class, p -> pings.incrementAndGet());
        listener.listen(Pong.class, p -> pongs.incrementAndGet());

        listener.unlisten(Ping.class);

        bus.immediate(new Ping());
        bus.immediate(new Pong());
        assertEquals(0, pings.get());
        assertEquals(1, pongs.get());
        assertTrue(listener.isActive());
        listener.close();
    }

    @Test
    void shouldLeaveOtherListenersRegistered() {
        AtomicInteger kept = new AtomicInteger();
        Listener leaving = new Listener(bus);
        Listener staying = new Listener(bus);
        leaving.listen(Ping.class, p -> fail("closed listener invoked"));
        staying.listen(Ping.class, p -> kept.incrementAndGet());

        leaving.unlisten(MessageType.of(Ping.class));
        leaving.unlistenAll();
        bus.immediate(new Ping());

        assertEquals(1, kept.get());
        staying.close();
    }

    @Test
    void shouldBeIdempotentWhenDisposedTwice() {
        Listener listener = new Listener(bus);
        listener.listen(Ping.class, p -> {
        });

        listener.unlistenAll();
        listener.unlistenAll();
        listener.close();
        listener.unlisten(Ping.class);

        assertFalse(listener.isActive());
        assertFalse(bus.hasListeners(Ping.class));
    }

    @Test
    void shouldIgnoreListenAfterDisposal() {
        AtomicInteger count = new AtomicInteger();
        Listener listener = new Listener(bus);
        listener.close();

        listener.listen(Ping.class, p -> count.incrementAndGet());
        bus.immediate(new Ping());

        assertEquals(0, count.get());
        assertFalse(bus.hasListeners(Ping.class));
    }

    @Test
    void shouldAllowDisposalAfterBusClosed() {
        Listener listener = new Listener(bus);
        listener.listen(Ping.class, p -> {
        });
        bus.close();

        assertDoesNotThrow(listener::close);
        assertFalse(listener.isActive());
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Listener(null));
        Listener listener = new Listener(bus);
        assertThrows(IllegalArgumentException.class, () -> listener.listen(Ping.class, null));
        assertThrows(IllegalArgumentException.class, () -> listener.listen((Class<Ping>) null, p -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> listener.unlisten((MessageType<?>) null));
        listener.close();
    }
}
