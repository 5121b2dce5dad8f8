/**
 * Bounded, multiplexed pool of backend change-feed subscriptions.
 *
 * @see io.changefeed.pool.ConnectionPool
 */
package io.changefeed.pool;
