package in.eventhub.domain.common;

/**
 * Event scope determines which connections receive an event.
 */
public enum EventScope {
    /**
     * BROADCAST: every live connection on every instance.
     */
    BROADCAST,

    /**
     * USER: all connections owned by one user id.
     */
    USER,

    /**
     * SESSION: all connections sharing one session id.
     */
    SESSION,

    /**
     * ROOM: all connections that joined a named room.
     */
    ROOM
}
