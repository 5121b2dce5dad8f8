package io.changefeed.model;

import java.util.List;

/**
 * What a {@link io.changefeed.ChangeListener} receives on each flush: either a single
 * {@link ChangeEvent} or a {@link ChangeBatch} of several.
 */
public sealed interface Delivery permits ChangeEvent, ChangeBatch {

    /**
     * Returns the delivered events in arrival order.
     *
     * @return one or more events
     */
    List<ChangeEvent> events();

    /**
     * Returns the number of delivered events.
     *
     * @return event count
     */
    default int count() {
        return events().size();
    }
}
