package io.changefeed.model;

import java.util.List;
import java.util.Objects;

/**
 * Envelope for a flush that delivers more than one event.
 *
 * @param events the events in arrival order (at least two)
 */
public record ChangeBatch(List<ChangeEvent> events) implements Delivery {

    /** Value of {@link #kind()}. */
    public static final String KIND = "batch";

    public ChangeBatch {
        Objects.requireNonNull(events, "events");
        if (events.size() < 2) {
            throw new IllegalArgumentException("a batch holds at least 2 events, got: " + events.size());
        }
        events = List.copyOf(events);
    }

    public String kind() {
        return KIND;
    }
}
