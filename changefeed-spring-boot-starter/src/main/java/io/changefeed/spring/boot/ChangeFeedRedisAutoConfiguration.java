package io.changefeed.spring.boot;

import io.changefeed.redis.LettuceRemoteCacheClient;
import io.changefeed.spi.RemoteCacheClient;
import io.lettuce.core.RedisClient;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the Redis remote cache.
 *
 * <p>Connects a {@link LettuceRemoteCacheClient} to {@code changefeed.redis.uri} when
 * Lettuce is on the classpath and no other {@link RemoteCacheClient} bean is defined.
 */
@AutoConfiguration(before = ChangeFeedAutoConfiguration.class)
@ConditionalOnClass({LettuceRemoteCacheClient.class, RedisClient.class})
@ConditionalOnProperty(prefix = "changefeed.redis", name = "uri")
@EnableConfigurationProperties(ChangeFeedProperties.class)
public class ChangeFeedRedisAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RemoteCacheClient.class)
    public LettuceRemoteCacheClient lettuceRemoteCacheClient(ChangeFeedProperties props) {
        return LettuceRemoteCacheClient.create(props.getRedis().getUri());
    }
}
