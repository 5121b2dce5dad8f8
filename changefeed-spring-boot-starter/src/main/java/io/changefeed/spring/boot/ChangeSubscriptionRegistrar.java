package io.changefeed.spring.boot;

import io.changefeed.ChangeAggregator;
import io.changefeed.ChangeListener;
import io.changefeed.Subscription;
import io.changefeed.model.SubscriptionSpec;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link ChangeSubscription} and subscribes them through
 * the {@link ChangeAggregator}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see ChangeSubscription
 */
public class ChangeSubscriptionRegistrar implements SmartInitializingSingleton, DisposableBean {
    private static final Logger logger = Logger.getLogger(ChangeSubscriptionRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final ChangeAggregator aggregator;
    private final List<Subscription> subscriptions = new ArrayList<>();

    public ChangeSubscriptionRegistrar(ListableBeanFactory beanFactory, ChangeAggregator aggregator) {
        this.beanFactory = beanFactory;
        this.aggregator = aggregator;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(ChangeSubscription.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ChangeListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @ChangeSubscription must implement ChangeListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation
            ChangeSubscription annotation = AnnotationUtils.findAnnotation(bean.getClass(), ChangeSubscription.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @ChangeSubscription annotation on " + bean.getClass().getName());
            }

            SubscriptionSpec spec;
            try {
                spec = new SubscriptionSpec(annotation.table(), annotation.filter(),
                        annotation.event(), annotation.priority());
            } catch (IllegalArgumentException e) {
                throw new BeanCreationException(beanName, "Invalid @ChangeSubscription: " + e.getMessage(), e);
            }
            String channel = annotation.channel().isEmpty() ? beanName : annotation.channel();
            subscriptions.add(aggregator.subscribe(channel, spec, listener));
            logger.log(Level.FINE, "Subscribed bean {0} to {1}", new Object[]{beanName, spec.poolKey()});
        }
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public void destroy() {
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }
}
