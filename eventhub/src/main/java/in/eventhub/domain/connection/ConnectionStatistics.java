package in.eventhub.domain.connection;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-connection traffic counters. Lives and dies with its connection.
 */
public final class ConnectionStatistics {
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public void recordSent(int bytes) {
        messagesSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    public void recordReceived(int bytes) {
        messagesReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    public void recordError() {
        errors.incrementAndGet();
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    public long getBytesSent() {
        return bytesSent.get();
    }

    public long getBytesReceived() {
        return bytesReceived.get();
    }

    public long getErrors() {
        return errors.get();
    }
}
