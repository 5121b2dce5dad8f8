package io.changefeed.spring.boot;

import io.changefeed.model.EventKind;
import io.changefeed.model.PriorityTier;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a change subscriber.
 *
 * <p>The annotated bean must implement {@link io.changefeed.ChangeListener}. It is
 * subscribed once all singletons are initialized and unsubscribed when the context closes.
 *
 * <pre>{@code
 * @Component
 * @ChangeSubscription(table = "likes", filter = "post_id=eq.42", priority = PriorityTier.HIGH)
 * public class LikeCounter implements ChangeListener {
 *   public void onChange(Delivery delivery) { ... }
 * }
 * }</pre>
 *
 * @see ChangeSubscriptionRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ChangeSubscription {

    /**
     * Table to listen to.
     */
    String table();

    /**
     * Backend row filter. Empty means all rows.
     */
    String filter() default "";

    EventKind event() default EventKind.ANY;

    PriorityTier priority() default PriorityTier.MEDIUM;

    /**
     * Channel name. Defaults to the bean name.
     */
    String channel() default "";
}
