/**
 * Request collapsing and the short-TTL result cache.
 *
 * @see io.changefeed.dedupe.RequestDeduplicator
 */
package io.changefeed.dedupe;
