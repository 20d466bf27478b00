package com.myorg.evreg.delivery.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.core.conventions.DeadLetterTopics;
import com.myorg.evreg.contracts.core.envelope.DeliveryJson;
import com.myorg.evreg.contracts.core.spi.BrokerClient;
import com.myorg.evreg.contracts.core.spi.DeadLetterSource;
import com.myorg.evreg.delivery.DeliveryMonitor;
import com.myorg.evreg.delivery.DeliveryProperties;
import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.ResilientDeliveryPublisher;
import com.myorg.evreg.delivery.ResilientSender;
import com.myorg.evreg.delivery.deadletter.DeadLetterRouter;
import com.myorg.evreg.delivery.fallback.FallbackReplayer;
import com.myorg.evreg.delivery.fallback.FallbackStore;
import com.myorg.evreg.delivery.fallback.LocalFileFallbackStore;
import com.myorg.evreg.delivery.idempotency.IdempotencyStore;
import com.myorg.evreg.delivery.idempotency.InMemoryIdempotencyStore;
import com.myorg.evreg.delivery.reprocess.DeadLetterRecoveryScanner;
import com.myorg.evreg.delivery.reprocess.DeadLetterReprocessor;
import com.myorg.evreg.delivery.reprocess.RecoveryHandlerRegistry;
import com.myorg.evreg.kafka.KafkaAutoConfiguration;
import com.myorg.evreg.kafka.KafkaConsumerAutoConfiguration;
import com.myorg.evreg.kafka.KafkaDeadLetterSource;
import com.myorg.evreg.kafka.KafkaErrorHandlingAutoConfiguration;
import com.myorg.evreg.kafka.KafkaProducerAutoConfiguration;
import com.myorg.evreg.resilience.breaker.CircuitBreaker;
import com.myorg.evreg.resilience.bulkhead.Bulkhead;
import com.myorg.evreg.resilience.classify.DefaultErrorClassifier;
import com.myorg.evreg.resilience.classify.ErrorClassifier;
import com.myorg.evreg.resilience.retry.RetryPolicy;
import com.myorg.evreg.resilience.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@AutoConfiguration(after = {
        KafkaAutoConfiguration.class,
        KafkaProducerAutoConfiguration.class,
        KafkaConsumerAutoConfiguration.class,
        KafkaErrorHandlingAutoConfiguration.class
})
@EnableConfigurationProperties(DeliveryProperties.class)
@ConditionalOnProperty(prefix = "evreg.delivery", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnBean(BrokerClient.class)
public class DeliveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock deliveryClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Bulkhead deliveryBulkhead(DeliveryProperties props) {
        return new Bulkhead(props.getBreakerName(),
                props.getBulkhead().getMaxConcurrent(),
                props.getBulkhead().getMaxQueue());
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreaker deliveryCircuitBreaker(DeliveryProperties props,
                                                 Clock deliveryClock,
                                                 ObjectProvider<DeliveryMonitor> monitors) {
        DeliveryMonitor monitor = monitorOf(monitors);
        return new CircuitBreaker(
                props.getBreakerName(),
                props.getCircuitBreaker().getFailureThreshold(),
                props.getCircuitBreaker().getResetTimeout(),
                deliveryClock,
                monitor::onCircuitStateChange
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy deliveryRetryPolicy(DeliveryProperties props,
                                           Clock deliveryClock,
                                           ObjectProvider<ErrorClassifier> classifierProvider) {
        DeliveryProperties.Retry r = props.getRetry();
        return new RetryPolicy(
                r.getMaxAttempts(),
                r.getBaseDelay(),
                r.getMaxDelay(),
                r.getJitter(),
                classifierProvider.getIfAvailable(DefaultErrorClassifier::new),
                Sleeper.THREAD,
                deliveryClock
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilientSender resilientSender(BrokerClient broker,
                                           Bulkhead bulkhead,
                                           CircuitBreaker breaker,
                                           RetryPolicy retry,
                                           DeliveryProperties props,
                                           Clock deliveryClock,
                                           ObjectProvider<DeliveryMonitor> monitors) {
        return new ResilientSender(broker, bulkhead, breaker, retry,
                props.getSendTimeout(), props.getDeliveryTimeout(), deliveryClock, monitorOf(monitors));
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackStore fallbackStore(DeliveryProperties props,
                                       Clock deliveryClock,
                                       ObjectProvider<ObjectMapper> mapperProvider) {
        return new LocalFileFallbackStore(
                Path.of(props.getFallback().getDirectory()),
                mapperProvider.getIfAvailable(DeliveryJson::defaultMapper),
                deliveryClock
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRouter deadLetterRouter(ResilientSender sender,
                                             ObjectProvider<DeadLetterTopics> topicsProvider,
                                             FallbackStore fallbackStore,
                                             ObjectProvider<ErrorClassifier> classifierProvider,
                                             Clock deliveryClock,
                                             ObjectProvider<DeliveryMonitor> monitors) {
        return new DeadLetterRouter(
                sender,
                topicsProvider.getIfAvailable(DeadLetterTopics::defaults),
                fallbackStore,
                classifierProvider.getIfAvailable(DefaultErrorClassifier::new),
                deliveryClock,
                monitorOf(monitors)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DeliveryPublisher deliveryPublisher(ResilientSender sender, DeadLetterRouter router) {
        return new ResilientDeliveryPublisher(sender, router);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryHandlerRegistry recoveryHandlerRegistry() {
        return new RecoveryHandlerRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRecoveryScanner deadLetterRecoveryScanner(ApplicationContext ctx,
                                                               RecoveryHandlerRegistry registry,
                                                               ObjectProvider<ObjectMapper> mapperProvider) {
        return new DeadLetterRecoveryScanner(ctx, registry, mapperProvider.getIfAvailable(DeliveryJson::defaultMapper));
    }

    // ---------------- Dead-letter reprocessing ----------------

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(DeadLetterSource.class)
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor", name = "enabled", havingValue = "true")
    public DeadLetterSource deadLetterSource(@Qualifier("deadLetterConsumerFactory") ObjectProvider<ConsumerFactory<String, String>> named,
                                             ObjectProvider<DeadLetterTopics> topicsProvider,
                                             ObjectProvider<ObjectMapper> mapperProvider) {
        ConsumerFactory<String, String> cf = named.getIfAvailable();
        if (cf == null) {
            throw new IllegalStateException(
                    "evreg.delivery.reprocessor.enabled=true but no 'deadLetterConsumerFactory' bean exists. "
                            + "Add spring-kafka and evreg-kafka-starter or provide a DeadLetterSource bean.");
        }
        return new KafkaDeadLetterSource(
                cf,
                topicsProvider.getIfAvailable(DeadLetterTopics::defaults),
                mapperProvider.getIfAvailable(DeliveryJson::defaultMapper)
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor", name = "enabled", havingValue = "true")
    public DeadLetterReprocessor deadLetterReprocessor(DeadLetterSource source,
                                                       DeadLetterRouter router,
                                                       RecoveryHandlerRegistry registry,
                                                       ObjectProvider<IdempotencyStore> storeProvider,
                                                       DeliveryProperties props,
                                                       ObjectProvider<DeliveryMonitor> monitors) {
        DeliveryProperties.Reprocessor rp = props.getReprocessor();
        IdempotencyStore store = rp.getIdempotency().isEnabled() ? storeProvider.getIfAvailable() : null;
        return new DeadLetterReprocessor(source, router, registry, store,
                rp.getMaxRetries(), rp.getPollTimeout(), monitorOf(monitors));
    }

    // ---------------- Fallback replay ----------------

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "evreg.delivery.fallback.replay", name = "enabled", havingValue = "true")
    public FallbackReplayer fallbackReplayer(FallbackStore fallbackStore, ResilientSender sender) {
        return new FallbackReplayer(fallbackStore, sender);
    }

    // ---------------- Scheduling ----------------

    @Bean(name = "evregDeliverySchedule")
    public DeliveryScheduleValues evregDeliveryScheduleValues(DeliveryProperties props) {
        return new DeliveryScheduleValues(props);
    }

    @Bean
    @ConditionalOnExpression("${evreg.delivery.reprocessor.enabled:false} or ${evreg.delivery.fallback.replay.enabled:false}")
    public DeliveryScheduledJobs deliveryScheduledJobs(DeliveryProperties props,
                                                       ObjectProvider<DeadLetterReprocessor> reprocessor,
                                                       ObjectProvider<FallbackReplayer> replayer) {
        return new DeliveryScheduledJobs(props, reprocessor.getIfAvailable(), replayer.getIfAvailable());
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnExpression(
            "(${evreg.delivery.reprocessor.enabled:false} and ${evreg.delivery.reprocessor.scheduling-enabled:false}) or "
                    + "(${evreg.delivery.fallback.replay.enabled:false} and ${evreg.delivery.fallback.replay.scheduling-enabled:true})")
    static class SchedulingConfig {}

    // ---------------- Idempotency store ----------------

    /**
     * store=memory (default): single-instance store. For several reprocessor instances use store=redis.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor.idempotency", name = "enabled", havingValue = "true")
    @ConditionalOnExpression("'${evreg.delivery.reprocessor.idempotency.store:memory}'.toLowerCase() != 'redis'")
    static class MemoryIdempotencyConfig {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(IdempotencyStore.class)
        public IdempotencyStore recoveryIdempotencyStore(DeliveryProperties props, Clock deliveryClock) {
            DeliveryProperties.Idempotency idem = props.getReprocessor().getIdempotency();
            return new InMemoryIdempotencyStore(
                    idem.getKeyPrefix(),
                    idem.getTtl(),
                    idem.getProcessingTtl(),
                    idem.getMaxEntries(),
                    idem.getCleanupInterval(),
                    deliveryClock
            );
        }
    }

    /**
     * store=redis but Redis is not on the classpath: fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor.idempotency", name = "enabled", havingValue = "true")
    @ConditionalOnProperty(prefix = "evreg.delivery.reprocessor.idempotency", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.core.StringRedisTemplate")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object failFastRedisMissing() {
            throw new IllegalStateException(
                    "evreg.delivery.reprocessor.idempotency.store=redis but Redis is not on the classpath. "
                            + "Add spring-boot-starter-data-redis (and configure spring.data.redis.*).");
        }
    }

    private static DeliveryMonitor monitorOf(ObjectProvider<DeliveryMonitor> monitors) {
        return DeliveryMonitor.composite(monitors.orderedStream().toList());
    }
}
