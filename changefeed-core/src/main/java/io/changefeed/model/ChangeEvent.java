package io.changefeed.model;

import io.changefeed.spi.RawChange;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A validated row change.
 *
 * <ul>
 *   <li>{@link Insert} carries the new row.</li>
 *   <li>{@link Update} carries the row before and after. The before image may be empty
 *       when the backend does not publish old values.</li>
 *   <li>{@link Delete} carries the removed row.</li>
 * </ul>
 *
 * <p>Use {@link #from(RawChange, String)} to convert feed payloads; it rejects anything
 * that does not fit one of the three shapes.
 */
public sealed interface ChangeEvent extends Delivery
    permits ChangeEvent.Insert, ChangeEvent.Update, ChangeEvent.Delete {

    /**
     * Returns the table the change happened on.
     *
     * @return table name
     */
    String table();

    /**
     * Returns the concrete kind of this change (never {@link EventKind#ANY}).
     *
     * @return change kind
     */
    EventKind kind();

    @Override
    default List<ChangeEvent> events() {
        return List.of(this);
    }

    /**
     * Converts and validates a raw feed change.
     *
     * @param raw           the raw change
     * @param expectedTable table the subscription listens on, or {@code null} to skip the check
     * @return the typed event
     * @throws MalformedChangeException if the event type is unknown, a required row is
     *     missing, or the table does not match
     */
    static ChangeEvent from(RawChange raw, String expectedTable) {
        Objects.requireNonNull(raw, "raw");
        if (raw.table() == null || raw.table().isEmpty()) {
            throw new MalformedChangeException("table is missing");
        }
        if (expectedTable != null && !expectedTable.equals(raw.table())) {
            throw new MalformedChangeException(
                "change for table " + raw.table() + " arrived on a subscription for " + expectedTable);
        }
        EventKind kind = EventKind.parse(raw.eventType());
        switch (kind) {
            case INSERT:
                return new Insert(raw.table(), requireRow(raw.newRow(), kind, "new"));
            case UPDATE:
                Map<String, Object> before = raw.oldRow() != null ? raw.oldRow() : Map.of();
                return new Update(raw.table(), RowSnapshot.of(before), requireRow(raw.newRow(), kind, "new"));
            case DELETE:
                return new Delete(raw.table(), requireRow(raw.oldRow(), kind, "old"));
            default:
                throw new MalformedChangeException("eventType must be INSERT, UPDATE or DELETE, got: "
                    + raw.eventType());
        }
    }

    private static RowSnapshot requireRow(Map<String, Object> row, EventKind kind, String which) {
        if (row == null) {
            throw new MalformedChangeException(kind + " change is missing its " + which + " row");
        }
        return RowSnapshot.of(row);
    }

    /**
     * A row was inserted.
     *
     * @param table table name
     * @param after the inserted row
     */
    record Insert(String table, RowSnapshot after) implements ChangeEvent {
        public Insert {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(after, "after");
        }

        @Override
        public EventKind kind() {
            return EventKind.INSERT;
        }
    }

    /**
     * A row was updated.
     *
     * @param table  table name
     * @param before the row before the update (may have no columns)
     * @param after  the row after the update
     */
    record Update(String table, RowSnapshot before, RowSnapshot after) implements ChangeEvent {
        public Update {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(before, "before");
            Objects.requireNonNull(after, "after");
        }

        @Override
        public EventKind kind() {
            return EventKind.UPDATE;
        }
    }

    /**
     * A row was deleted.
     *
     * @param table  table name
     * @param before the deleted row
     */
    record Delete(String table, RowSnapshot before) implements ChangeEvent {
        public Delete {
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(before, "before");
        }

        @Override
        public EventKind kind() {
            return EventKind.DELETE;
        }
    }
}
