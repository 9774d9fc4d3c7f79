package com.p14n.eventbus.registry;

import com.p14n.eventbus.callback.ErasedCallback;
import com.p14n.eventbus.data.MessageType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Maps each message type to the callback groups registered for it.
 *
 * <p>
 * Groups for a type are kept in the order their listeners first registered
 * for it. An empty group is never kept, and neither is a type without groups.
 * </p>
 *
 * <p>
 * Not thread-safe. Callers confine the table to one thread or synchronize
 * externally.
 * </p>
 */
public class RegistrationTable {

    private final Map<MessageType<?>, List<CallbackGroup>> groupsByType = new HashMap<>();

    /**
     * Appends a callback to the listener's group for the type, creating the
     * group at the end of the type's sequence if needed.
     *
     * @param type       the message type
     * @param listenerId the registering listener
     * @param callback   the callback
     * @return true if a new group was created for this listener and type
     */
    public boolean add(MessageType<?> type, int listenerId, ErasedCallback callback) {
        List<CallbackGroup> groups = groupsByType.computeIfAbsent(type, k -> new ArrayList<>());
        for (CallbackGroup group : groups) {
            if (group.listenerId() == listenerId) {
                group.add(callback);
                return false;
            }
        }
        CallbackGroup group = new CallbackGroup(listenerId);
        group.add(callback);
        groups.add(group);
        return true;
    }

    /**
     * Removes the listener's group for one type.
     *
     * @param type       the message type
     * @param listenerId the listener
     * @return true if a group was removed
     */
    public boolean remove(MessageType<?> type, int listenerId) {
        List<CallbackGroup> groups = groupsByType.get(type);
        if (groups == null) {
            return false;
        }
        boolean removed = groups.removeIf(g -> g.listenerId() == listenerId);
        if (groups.isEmpty()) {
            groupsByType.remove(type);
        }
        return removed;
    }

    /**
     * Removes the listener's groups for every type.
     *
     * @param listenerId the listener
     * @return the types a group was removed from
     */
    public List<MessageType<?>> removeListener(int listenerId) {
        List<MessageType<?>> removedFrom = new ArrayList<>();
        Iterator<Map.Entry<MessageType<?>, List<CallbackGroup>>> it = groupsByType.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<MessageType<?>, List<CallbackGroup>> entry = it.next();
            if (entry.getValue().removeIf(g -> g.listenerId() == listenerId)) {
                removedFrom.add(entry.getKey());
            }
            if (entry.getValue().isEmpty()) {
                it.remove();
            }
        }
        return removedFrom;
    }

    /**
     * Returns a copy of the callbacks registered for a type, in group order
     * then registration order within each group.
     *
     * @param type the message type
     * @return the callbacks, empty if the type is unknown
     */
    public List<ErasedCallback> snapshot(MessageType<?> type) {
        List<CallbackGroup> groups = groupsByType.get(type);
        if (groups == null) {
            return Collections.emptyList();
        }
        List<ErasedCallback> callbacks = new ArrayList<>();
        for (CallbackGroup group : groups) {
            callbacks.addAll(group.callbacks());
        }
        return callbacks;
    }

    /**
     * Visits every callback registered for a type. The visit runs over a
     * snapshot taken on entry, so a visitor may add or remove registrations
     * without disturbing the iteration.
     *
     * @param type    the message type
     * @param visitor receives each callback
     */
    public void forEach(MessageType<?> type, Consumer<ErasedCallback> visitor) {
        for (ErasedCallback callback : snapshot(type)) {
            visitor.accept(callback);
        }
    }

    /**
     * Returns the groups registered for a type.
     *
     * @param type the message type
     * @return a read-only copy of the groups, empty if the type is unknown
     */
    public List<CallbackGroup> groups(MessageType<?> type) {
        List<CallbackGroup> groups = groupsByType.get(type);
        return groups == null ? Collections.emptyList() : List.copyOf(groups);
    }

    /**
     * Returns whether any group is registered for a type.
     *
     * @param type the message type
     * @return true if the type has an entry
     */
    public boolean contains(MessageType<?> type) {
        return groupsByType.containsKey(type);
    }

    /**
     * Returns the number of types with at least one group.
     *
     * @return the type count
     */
    public int typeCount() {
        return groupsByType.size();
    }

    /**
     * Returns whether no registrations remain.
     *
     * @return true if the table is empty
     */
    public boolean isEmpty() {
        return groupsByType.isEmpty();
    }

    /**
     * Removes every registration.
     */
    public void clear() {
        groupsByType.clear();
    }
}
