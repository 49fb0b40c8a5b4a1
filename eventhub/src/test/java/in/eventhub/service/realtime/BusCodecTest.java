package in.eventhub.service.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.eventhub.domain.common.EventScope;
import in.eventhub.domain.common.NotificationLevel;
import in.eventhub.domain.event.Event;
import in.eventhub.domain.event.EventTarget;
import in.eventhub.domain.event.Notification;
import in.eventhub.domain.event.ProgressUpdate;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BusCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final BusCodec codec = new BusCodec(MAPPER);

    @Test
    void testEncodedEventCarriesTargetAndOrigin() throws Exception {
        Event event = Event.create("doc.saved", MAPPER.createObjectNode().put("rev", 2),
            EventTarget.session("s-1"), "node-a", Instant.parse("2024-03-01T10:00:00Z"));

        JsonNode json = MAPPER.readTree(codec.encodeEvent(event));

        assertEquals(event.eventId(), json.path("id").asText());
        assertEquals("doc.saved", json.path("type").asText());
        assertEquals("2024-03-01T10:00:00Z", json.path("timestamp").asText());
        assertEquals(2, json.path("data").path("rev").asInt());
        assertEquals("session", json.path("target").path("scope").asText());
        assertEquals("s-1", json.path("target").path("id").asText());
        assertEquals("node-a", json.path("origin").asText());
    }

    @Test
    void testDecodeEventFillsDefaults() {
        Event event = codec.decodeEvent("{\"type\":\"bare\"}");

        assertEquals("bare", event.type());
        assertNotNull(event.eventId(), "Missing id is generated");
        assertNotNull(event.timestamp());
        assertTrue(event.target().isBroadcast());
        assertTrue(event.data().isObject());
        assertNull(event.origin());
    }

    @Test
    void testDecodeEventWithRoomTarget() {
        Event event = codec.decodeEvent(
            "{\"id\":\"e-1\",\"type\":\"t\",\"target\":{\"scope\":\"room\",\"id\":\"lobby\"},\"origin\":\"x\"}");

        assertEquals("e-1", event.eventId());
        assertEquals(EventScope.ROOM, event.target().scope());
        assertEquals("lobby", event.target().id());
        assertEquals("x", event.origin());
    }

    @Test
    void testMalformedEvents() {
        assertThrows(BusCodec.MalformedBusMessageException.class, () -> codec.decodeEvent("{oops"));
        assertThrows(BusCodec.MalformedBusMessageException.class, () -> codec.decodeEvent("[1,2]"));
        assertThrows(BusCodec.MalformedBusMessageException.class, () -> codec.decodeEvent("{\"id\":\"no-type\"}"));
        assertThrows(BusCodec.MalformedBusMessageException.class,
            () -> codec.decodeEvent("{\"type\":\"t\",\"timestamp\":\"yesterday\"}"));
        assertThrows(BusCodec.MalformedBusMessageException.class,
            () -> codec.decodeEvent("{\"type\":\"t\",\"target\":{\"scope\":\"galaxy\",\"id\":\"x\"}}"));
        assertThrows(BusCodec.MalformedBusMessageException.class,
            () -> codec.decodeEvent("{\"type\":\"t\",\"target\":{\"scope\":\"user\"}}"), "User target needs an id");
        assertThrows(BusCodec.MalformedBusMessageException.class, () -> codec.decodeEvent(null));
    }

    @Test
    void testDecodeProgress() {
        ProgressUpdate update = codec.decodeProgress(
            "{\"operation_id\":\"op-1\",\"fields\":{\"percentage\":75}}");

        assertEquals("op-1", update.operationId());
        assertEquals(75, update.fields().path("percentage").asInt());
        assertTrue(update.target().isBroadcast());
    }

    @Test
    void testMalformedProgress() {
        assertThrows(BusCodec.MalformedBusMessageException.class, () -> codec.decodeProgress("{}"));
        assertThrows(BusCodec.MalformedBusMessageException.class,
            () -> codec.decodeProgress("{\"operation_id\":\"op\",\"fields\":[1]}"));
    }

    @Test
    void testDecodeNotificationIsLenientOnLevel() {
        Notification notification = codec.decodeNotification(
            "{\"level\":\"shouting\",\"title\":\"Heads up\",\"target\":{\"scope\":\"user\",\"id\":\"u1\"}}");

        assertEquals(NotificationLevel.INFO, notification.level());
        assertEquals("Heads up", notification.title());
        assertEquals("", notification.message());
        assertEquals(EventTarget.user("u1"), notification.target());
    }

    @Test
    void testNotificationNeedsTitleOrMessage() {
        assertThrows(BusCodec.MalformedBusMessageException.class,
            () -> codec.decodeNotification("{\"level\":\"error\"}"));
    }
}
