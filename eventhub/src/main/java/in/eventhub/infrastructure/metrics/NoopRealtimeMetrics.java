package in.eventhub.infrastructure.metrics;

import in.eventhub.domain.message.MessageType;

enum NoopRealtimeMetrics implements RealtimeMetrics {
    INSTANCE;

    @Override
    public void connectionOpened() {
    }

    @Override
    public void connectionClosed() {
    }

    @Override
    public void handshakeFailed() {
    }

    @Override
    public void messageSent(MessageType type, int bytes) {
    }

    @Override
    public void rateLimited() {
    }

    @Override
    public void sendFailed() {
    }

    @Override
    public void busMessage(String topic, String outcome) {
    }

    @Override
    public void heartbeat(int delivered) {
    }
}
