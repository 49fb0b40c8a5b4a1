package in.eventhub.infrastructure.pubsub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPubSubBackboneTest {

    private static final Duration WAIT = Duration.ofMillis(200);

    private final InMemoryPubSubBackbone backbone = new InMemoryPubSubBackbone(3);

    @AfterEach
    void tearDown() {
        backbone.close();
    }

    @Test
    void testEverySubscriberGetsEachMessage() throws InterruptedException {
        PubSubBackbone.Subscription first = backbone.subscribe("t");
        PubSubBackbone.Subscription second = backbone.subscribe("t");
        PubSubBackbone.Subscription other = backbone.subscribe("other");

        assertEquals(2, backbone.publish("t", "hello"), "Receiver count");

        assertEquals("hello", first.poll(WAIT));
        assertEquals("hello", second.poll(WAIT));
        assertNull(other.poll(Duration.ofMillis(20)), "Other topics see nothing");
    }

    @Test
    void testPublishWithoutSubscribers() {
        assertEquals(0, backbone.publish("nobody", "x"));
    }

    @Test
    void testOverflowDropsOldest() throws InterruptedException {
        PubSubBackbone.Subscription sub = backbone.subscribe("t");

        for (int i = 1; i <= 5; i++) {
            backbone.publish("t", "m" + i);
        }

        assertEquals("m3", sub.poll(WAIT));
        assertEquals("m4", sub.poll(WAIT));
        assertEquals("m5", sub.poll(WAIT));
    }

    @Test
    void testClosedSubscriptionStopsReceiving() {
        PubSubBackbone.Subscription sub = backbone.subscribe("t");
        sub.close();
        sub.close();

        assertEquals(0, backbone.subscriberCount("t"));
        assertEquals(0, backbone.publish("t", "late"));
        assertThrows(PubSubException.class, () -> sub.poll(WAIT));
    }

    @Test
    void testClosedBackboneRejectsUse() {
        PubSubBackbone.Subscription sub = backbone.subscribe("t");
        backbone.close();

        assertThrows(PubSubException.class, () -> backbone.publish("t", "x"));
        assertThrows(PubSubException.class, () -> backbone.subscribe("t"));
        assertThrows(PubSubException.class, () -> sub.poll(WAIT));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryPubSubBackbone(0));
    }
}
