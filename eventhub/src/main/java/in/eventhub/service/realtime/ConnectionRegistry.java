package in.eventhub.service.realtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live connection map plus the user / session / room membership indices.
 *
 * Every mutation is one critical section under {@code lock}; every read used for fan-out
 * returns a copy taken under the same lock, so callers may disconnect while iterating it.
 * Invariants: each id in an index is a key of {@code connections}; empty buckets are removed.
 */
final class ConnectionRegistry {

    private final Object lock = new Object();

    private final Map<String, ConnectionEntry> connections = new LinkedHashMap<>();
    private final Map<String, Set<String>> userIndex = new HashMap<>();
    private final Map<String, Set<String>> sessionIndex = new HashMap<>();
    private final Map<String, Set<String>> roomIndex = new HashMap<>();

    /**
     * @return false if the id is already registered
     */
    boolean register(ConnectionEntry entry) {
        synchronized (lock) {
            if (connections.containsKey(entry.id())) {
                return false;
            }
            connections.put(entry.id(), entry);
            index(userIndex, entry.info().getUserId(), entry.id());
            index(sessionIndex, entry.info().getSessionId(), entry.id());
            return true;
        }
    }

    /**
     * Remove a connection from the live map and from every index.
     *
     * @return the removed entry, or null if it was not registered
     */
    ConnectionEntry remove(String connectionId) {
        synchronized (lock) {
            ConnectionEntry entry = connections.remove(connectionId);
            if (entry == null) {
                return null;
            }
            unindex(userIndex, entry.info().getUserId(), connectionId);
            unindex(sessionIndex, entry.info().getSessionId(), connectionId);
            for (String room : entry.info().getRooms()) {
                unindex(roomIndex, room, connectionId);
                entry.info().removeRoom(room);
            }
            return entry;
        }
    }

    ConnectionEntry get(String connectionId) {
        synchronized (lock) {
            return connections.get(connectionId);
        }
    }

    boolean contains(String connectionId) {
        synchronized (lock) {
            return connections.containsKey(connectionId);
        }
    }

    /**
     * @return false if the connection is not registered
     */
    boolean joinRoom(String connectionId, String room) {
        synchronized (lock) {
            ConnectionEntry entry = connections.get(connectionId);
            if (entry == null) {
                return false;
            }
            index(roomIndex, room, connectionId);
            entry.info().addRoom(room);
            return true;
        }
    }

    /**
     * @return true if the connection was a member of the room
     */
    boolean leaveRoom(String connectionId, String room) {
        synchronized (lock) {
            boolean removed = unindex(roomIndex, room, connectionId);
            ConnectionEntry entry = connections.get(connectionId);
            if (entry != null) {
                entry.info().removeRoom(room);
            }
            return removed;
        }
    }

    List<String> snapshotIds() {
        synchronized (lock) {
            return new ArrayList<>(connections.keySet());
        }
    }

    List<String> snapshotUser(String userId) {
        return snapshot(userIndex, userId);
    }

    List<String> snapshotSession(String sessionId) {
        return snapshot(sessionIndex, sessionId);
    }

    List<String> snapshotRoom(String room) {
        return snapshot(roomIndex, room);
    }

    Set<String> roomNames() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(roomIndex.keySet()));
        }
    }

    /**
     * Entries and index sizes captured atomically.
     */
    Snapshot snapshot() {
        synchronized (lock) {
            return new Snapshot(new ArrayList<>(connections.values()),
                userIndex.size(), sessionIndex.size(), roomIndex.size());
        }
    }

    record Snapshot(List<ConnectionEntry> entries, int users, int sessions, int rooms) {
    }

    private List<String> snapshot(Map<String, Set<String>> index, String key) {
        if (key == null) {
            return List.of();
        }
        synchronized (lock) {
            Set<String> ids = index.get(key);
            return ids == null ? List.of() : new ArrayList<>(ids);
        }
    }

    private static void index(Map<String, Set<String>> index, String key, String connectionId) {
        if (key != null) {
            index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(connectionId);
        }
    }

    private static boolean unindex(Map<String, Set<String>> index, String key, String connectionId) {
        if (key == null) {
            return false;
        }
        Set<String> ids = index.get(key);
        if (ids == null) {
            return false;
        }
        boolean removed = ids.remove(connectionId);
        if (ids.isEmpty()) {
            index.remove(key);
        }
        return removed;
    }
}
