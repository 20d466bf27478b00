package com.myorg.evreg.delivery.autoconfig;

import com.myorg.evreg.delivery.DeliveryProperties;
import com.myorg.evreg.delivery.idempotency.IdempotencyStore;
import com.myorg.evreg.delivery.idempotency.RedisIdempotencyStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed recovery idempotency. Kept apart from {@link DeliveryAutoConfiguration} so applications
 * without Redis on the classpath can still use store=memory.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class, before = DeliveryAutoConfiguration.class)
@EnableConfigurationProperties(DeliveryProperties.class)
@ConditionalOnClass({RedisConnectionFactory.class, StringRedisTemplate.class})
public class DeliveryRedisAutoConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor.idempotency", name = "enabled", havingValue = "true")
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor.idempotency", name = "store", havingValue = "redis")
    static class RedisIdempotencyConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(IdempotencyStore.class)
        public IdempotencyStore recoveryIdempotencyStore(DeliveryProperties props, StringRedisTemplate redis) {
            DeliveryProperties.Idempotency idem = props.getReprocessor().getIdempotency();
            return new RedisIdempotencyStore(redis, idem.getTtl(), idem.getProcessingTtl(), idem.getKeyPrefix());
        }
    }
}
