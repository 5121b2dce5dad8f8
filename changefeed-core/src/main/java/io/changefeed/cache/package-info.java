/**
 * Remote cache access: a degrade-don't-throw client wrapper and the read-through cache
 * built on top of it.
 *
 * @see io.changefeed.cache.ReadThroughCache
 * @see io.changefeed.cache.ResilientCacheClient
 */
package io.changefeed.cache;
