package io.changefeed.spring.boot;

import io.changefeed.ChangeAggregator;
import io.changefeed.spi.ChangeFeed;
import io.changefeed.spi.ErrorHandler;
import io.changefeed.spi.MetricsExporter;
import io.changefeed.spi.RemoteCacheClient;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for changefeed.
 *
 * <p>Wires up a {@link ChangeAggregator} from the application's {@link ChangeFeed} bean
 * and {@link ChangeFeedProperties}. A {@link RemoteCacheClient}, {@link MetricsExporter}
 * or {@link ErrorHandler} bean is picked up when present.
 *
 * @see ChangeFeedProperties
 * @see ChangeFeedMicrometerAutoConfiguration
 * @see ChangeFeedRedisAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(ChangeAggregator.class)
@ConditionalOnBean(ChangeFeed.class)
@EnableConfigurationProperties(ChangeFeedProperties.class)
public class ChangeFeedAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ChangeAggregator changeAggregator(ChangeFeed feed,
                                             ChangeFeedProperties props,
                                             ObjectProvider<RemoteCacheClient> remoteCacheProvider,
                                             ObjectProvider<MetricsExporter> metricsProvider,
                                             ObjectProvider<ErrorHandler> errorHandlerProvider) {
        var builder = ChangeAggregator.builder()
                .feed(feed)
                .config(props.toAggregatorConfig());
        RemoteCacheClient remoteCache = remoteCacheProvider.getIfAvailable();
        if (remoteCache != null) {
            builder.remoteCache(remoteCache);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        ErrorHandler errorHandler = errorHandlerProvider.getIfAvailable();
        if (errorHandler != null) {
            builder.errorHandler(errorHandler);
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChangeSubscriptionRegistrar changeSubscriptionRegistrar(ListableBeanFactory beanFactory,
                                                                   ChangeAggregator aggregator) {
        return new ChangeSubscriptionRegistrar(beanFactory, aggregator);
    }
}
