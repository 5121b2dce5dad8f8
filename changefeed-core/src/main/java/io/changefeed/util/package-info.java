/**
 * Threading utilities and the default event-loop {@link io.changefeed.spi.TimerService}.
 */
package io.changefeed.util;
