package in.eventhub.domain.event;

import in.eventhub.domain.common.EventScope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTargetTest {

    @Test
    void testBroadcastHasNoId() {
        EventTarget target = new EventTarget(EventScope.BROADCAST, "ignored");

        assertTrue(target.isBroadcast());
        assertNull(target.id());
        assertEquals(EventTarget.broadcast(), target);
    }

    @Test
    void testScopedTargetsRequireId() {
        assertThrows(IllegalArgumentException.class, () -> EventTarget.user(null));
        assertThrows(IllegalArgumentException.class, () -> EventTarget.session(" "));
        assertThrows(IllegalArgumentException.class, () -> EventTarget.room(""));
    }

    @Test
    void testParseWireScope() {
        assertEquals(EventTarget.user("u1"), EventTarget.of("user", "u1"));
        assertEquals(EventTarget.room("r"), EventTarget.of(" ROOM ", "r"));
        assertTrue(EventTarget.of(null, "x").isBroadcast());
        assertTrue(EventTarget.of("", null).isBroadcast());
        assertThrows(IllegalArgumentException.class, () -> EventTarget.of("planet", "p"));
    }
}
