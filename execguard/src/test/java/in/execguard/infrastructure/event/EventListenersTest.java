package in.execguard.infrastructure.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class EventListenersTest {

    @Test
    void deliversToEveryListenerInOrder() {
        EventListeners<String> listeners = new EventListeners<>("Test");
        List<String> received = new ArrayList<>();
        listeners.add(e -> received.add("a:" + e));
        listeners.add(e -> received.add("b:" + e));

        listeners.publish("x");

        assertEquals(List.of("a:x", "b:x"), received);
    }

    @Test
    void throwingListenerDoesNotStopDelivery() {
        EventListeners<String> listeners = new EventListeners<>("Test");
        List<String> received = new ArrayList<>();
        listeners.add(e -> {
            throw new IllegalStateException("boom");
        });
        listeners.add(received::add);

        listeners.publish("x");

        assertEquals(List.of("x"), received);
    }

    @Test
    void removeAndClear() {
        EventListeners<String> listeners = new EventListeners<>("Test");
        Consumer<String> listener = e -> {};
        listeners.add(listener);
        listeners.add(e -> {});

        assertTrue(listeners.remove(listener));
        assertFalse(listeners.remove(listener));
        assertEquals(1, listeners.size());

        listeners.clear();
        assertEquals(0, listeners.size());
    }

    @Test
    void rejectsNullListener() {
        assertThrows(IllegalArgumentException.class, () -> new EventListeners<String>("Test").add(null));
    }
}
