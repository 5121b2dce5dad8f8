package io.changefeed.spi;

import java.util.Map;

/**
 * Untyped row-level change as delivered by a {@link ChangeFeed}.
 *
 * <p>Raw changes are validated into {@link io.changefeed.model.ChangeEvent}s by the
 * connection pool before any listener sees them.
 *
 * @param eventType the backend's event type ({@code INSERT}, {@code UPDATE} or {@code DELETE})
 * @param table     the table the change happened on
 * @param oldRow    the row before the change, or {@code null}
 * @param newRow    the row after the change, or {@code null}
 */
public record RawChange(String eventType, String table, Map<String, Object> oldRow,
                        Map<String, Object> newRow) {
}
