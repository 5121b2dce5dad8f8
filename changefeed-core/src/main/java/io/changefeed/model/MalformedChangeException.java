package io.changefeed.model;

import io.changefeed.ChangeFeedException;

/**
 * Thrown when a raw feed change cannot be turned into a {@link ChangeEvent}.
 */
public final class MalformedChangeException extends ChangeFeedException {

    public MalformedChangeException(String message) {
        super(message);
    }
}
