package io.changefeed.model;

import java.util.Locale;

/**
 * Kind of row change a subscription listens for.
 */
public enum EventKind {
    INSERT,
    UPDATE,
    DELETE,
    /** Matches every kind. */
    ANY;

    /**
     * Returns whether an event of kind {@code actual} is wanted by a subscription of this kind.
     *
     * @param actual the kind of a concrete event (never {@link #ANY})
     * @return {@code true} if this is {@link #ANY} or equal to {@code actual}
     */
    public boolean matches(EventKind actual) {
        return this == ANY || this == actual;
    }

    /**
     * Parses a backend event type, case-insensitively. {@code "*"} maps to {@link #ANY}.
     *
     * @param value the event type string
     * @return the matching kind
     * @throws MalformedChangeException if {@code value} is null or unknown
     */
    public static EventKind parse(String value) {
        if (value == null) {
            throw new MalformedChangeException("eventType is missing");
        }
        if ("*".equals(value)) {
            return ANY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedChangeException("Unknown eventType: " + value);
        }
    }
}
