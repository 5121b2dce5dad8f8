/**
 * Spring Boot auto-configuration for changefeed.
 *
 * <p>Define a {@link io.changefeed.spi.ChangeFeed} bean and a
 * {@link io.changefeed.ChangeAggregator} is created from {@code changefeed.*} properties.
 * Beans annotated with {@link io.changefeed.spring.boot.ChangeSubscription} are
 * subscribed automatically.
 */
package io.changefeed.spring.boot;
