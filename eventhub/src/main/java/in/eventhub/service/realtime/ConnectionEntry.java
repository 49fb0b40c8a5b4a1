package in.eventhub.service.realtime;

import in.eventhub.domain.connection.ClientTransport;
import in.eventhub.domain.connection.ConnectionInfo;
import in.eventhub.domain.connection.ConnectionStatistics;

/**
 * Everything the registry holds for one live connection.
 */
record ConnectionEntry(
    ClientTransport transport,
    ConnectionInfo info,
    ConnectionStatistics statistics,
    RateLimiter.Window rateWindow
) {
    String id() {
        return info.getConnectionId();
    }
}
