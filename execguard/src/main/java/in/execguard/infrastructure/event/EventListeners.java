package in.execguard.infrastructure.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listener list for a component's events.
 *
 * A throwing listener is logged and does not stop delivery to the others.
 */
public final class EventListeners<E> {
    private static final Logger log = LoggerFactory.getLogger(EventListeners.class);

    private final String owner;
    private final List<Consumer<E>> listeners = new CopyOnWriteArrayList<>();

    public EventListeners(String owner) {
        this.owner = owner;
    }

    public void add(Consumer<E> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        listeners.add(listener);
    }

    public boolean remove(Consumer<E> listener) {
        return listeners.remove(listener);
    }

    public void publish(E event) {
        for (Consumer<E> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("[{}] Event listener failed for {}: {}", owner, event, e.getMessage(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }

    public void clear() {
        listeners.clear();
    }
}
