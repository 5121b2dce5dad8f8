/**
 * Debounced, size-bounded batching of change events per channel.
 */
package io.changefeed.batch;
