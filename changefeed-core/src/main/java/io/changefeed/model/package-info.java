/**
 * Value types: subscription specs, priority tiers and the typed change events
 * delivered to listeners.
 *
 * @see io.changefeed.model.SubscriptionSpec
 * @see io.changefeed.model.ChangeEvent
 * @see io.changefeed.model.ChangeBatch
 */
package io.changefeed.model;
