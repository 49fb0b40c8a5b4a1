package in.eventhub.transport.ws;

/**
 * WebSocket stream flavours, one per endpoint path.
 */
public enum StreamKind {
    /** {@code /ws}: general event stream. */
    EVENTS("/ws", null),
    /** {@code /ws/progress/{operationId}}: follows one long-running operation. */
    PROGRESS("/ws/progress/{operationId}", "operationId"),
    /** {@code /ws/notifications}: system notifications. */
    NOTIFICATIONS("/ws/notifications", null),
    /** {@code /ws/session/{sessionId}}: collaborative session, token required. */
    SESSION("/ws/session/{sessionId}", "sessionId");

    private final String pathTemplate;
    private final String pathParam;

    StreamKind(String pathTemplate, String pathParam) {
        this.pathTemplate = pathTemplate;
        this.pathParam = pathParam;
    }

    public String pathTemplate() {
        return pathTemplate;
    }

    /**
     * @return name of the path template parameter, or null if the path has none
     */
    public String pathParam() {
        return pathParam;
    }

    public boolean requiresToken() {
        return this == SESSION;
    }
}
