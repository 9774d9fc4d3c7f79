package com.p14n.eventbus.registry;

import com.p14n.eventbus.callback.ErasedCallback;
import com.p14n.eventbus.data.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationTableTest {

    private static final MessageType<String> TEXT = MessageType.of(String.class);
    private static final MessageType<Integer> NUMBER = MessageType.of(Integer.class);

    private RegistrationTable table;
    private List<String> calls;

    @BeforeEach
    void setUp() {
        table = new RegistrationTable();
        calls = new ArrayList<>();
    }

    private ErasedCallback recording(String name) {
        return payload -> calls.add(name);
    }

    @Test
    void shouldVisitGroupsThenCallbacksInRegistrationOrder() {
        assertTrue(table.add(TEXT, 1, recording("1a")));
        assertTrue(table.add(TEXT, 2, recording("2a")));
        assertFalse(table.add(TEXT, 1, recording("1b")));

        table.forEach(TEXT, callback -> callback.invoke("x"));

        assertEquals(List.of("1a", "1b", "2a"), calls);
        List<CallbackGroup> groups = table.groups(TEXT);
        assertEquals(2, groups.size());
        assertEquals(1, groups.get(0).listenerId());
        assertEquals(2, groups.get(0).callbacks().size());
    }

    @Test
    void shouldIgnoreUnknownType() {
        table.forEach(TEXT, callback -> fail("no callbacks expected"));
        assertTrue(table.snapshot(TEXT).isEmpty());
        assertFalse(table.remove(TEXT, 1));
    }

    @Test
    void shouldRemoveTypeEntryWhenLastGroupRemoved() {
        table.add(TEXT, 1, recording("1"));
        table.add(TEXT, 2, recording("2"));

        assertTrue(table.remove(TEXT, 1));
        assertTrue(table.contains(TEXT));
        assertFalse(table.remove(TEXT, 1));

        assertTrue(table.remove(TEXT, 2));
        assertFalse(table.contains(TEXT));
        assertTrue(table.isEmpty());
    }

    @Test
    void shouldRemoveListenerFromEveryType() {
        table.add(TEXT, 1, recording("text-1"));
        table.add(NUMBER, 1, recording("number-1"));
        table.add(NUMBER, 2, recording("number-2"));

        List<MessageType<?>> removedFrom = table.removeListener(1);

        assertEquals(2, removedFrom.size());
        assertTrue(removedFrom.containsAll(List.of(TEXT, NUMBER)));
        assertFalse(table.contains(TEXT));
        assertEquals(1, table.typeCount());

        table.forEach(NUMBER, callback -> callback.invoke(7));
        assertEquals(List.of("number-2"), calls);
    }

    @Test
    void shouldReturnNothingWhenListenerUnknown() {
        table.add(TEXT, 1, recording("1"));
        assertTrue(table.removeListener(42).isEmpty());
        assertEquals(1, table.typeCount());
    }

    @Test
    void shouldTolerateMutationDuringVisit() {
        table.add(TEXT, 1, payload -> {
            calls.add("1");
            table.add(TEXT, 3, recording("3"));
            table.remove(TEXT, 2);
        });
        table.add(TEXT, 2, recording("2"));

        table.forEach(TEXT, callback -> callback.invoke("x"));
        assertEquals(List.of("1", "2"), calls);

        calls.clear();
        table.forEach(TEXT, callback -> callback.invoke("x"));
        assertEquals(List.of("1", "3"), calls);
    }

    @Test
    void shouldClearEverything() {
        table.add(TEXT, 1, recording("1"));
        table.add(NUMBER, 2, recording("2"));

        table.clear();

        assertTrue(table.isEmpty());
        assertEquals(0, table.typeCount());
    }
}
