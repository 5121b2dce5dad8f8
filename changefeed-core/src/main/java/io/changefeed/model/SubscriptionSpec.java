package io.changefeed.model;

import java.util.Objects;

/**
 * What a subscription listens to and how urgently its changes must be delivered.
 *
 * <p>Subscriptions with the same {@link #poolKey()} share one backend connection.
 *
 * @param table     table name
 * @param filter    backend row filter expression (for example {@code user_id=eq.42}), or {@code null}
 * @param eventKind kind of change to deliver
 * @param priority  delivery tier
 */
public record SubscriptionSpec(String table, String filter, EventKind eventKind, PriorityTier priority) {

    public SubscriptionSpec {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(eventKind, "eventKind");
        Objects.requireNonNull(priority, "priority");
        if (table.isEmpty()) {
            throw new IllegalArgumentException("table must not be empty");
        }
        if (filter != null && filter.isEmpty()) {
            filter = null;
        }
    }

    /**
     * Creates a builder for the given table. Defaults: no filter, {@link EventKind#ANY},
     * {@link PriorityTier#MEDIUM}.
     *
     * @param table table name
     * @return a new builder
     */
    public static Builder builder(String table) {
        return new Builder(table);
    }

    /**
     * Returns {@code table:filter}, with {@code all} standing in for a missing filter.
     *
     * @return the pooling key
     */
    public String poolKey() {
        return table + ":" + (filter == null ? "all" : filter);
    }

    /** Builder for {@link SubscriptionSpec}. */
    public static final class Builder {
        private final String table;
        private String filter;
        private EventKind eventKind = EventKind.ANY;
        private PriorityTier priority = PriorityTier.MEDIUM;

        private Builder(String table) {
            this.table = table;
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder eventKind(EventKind eventKind) {
            this.eventKind = eventKind;
            return this;
        }

        public Builder priority(PriorityTier priority) {
            this.priority = priority;
            return this;
        }

        public SubscriptionSpec build() {
            return new SubscriptionSpec(table, filter, eventKind, priority);
        }
    }
}
