package com.myorg.evreg.observability;

import com.myorg.evreg.delivery.DeliveryPublisher;
import com.myorg.evreg.delivery.autoconfig.DeliveryAutoConfiguration;
import com.myorg.evreg.resilience.breaker.CircuitBreaker;
import com.myorg.evreg.resilience.bulkhead.Bulkhead;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(
        before = DeliveryAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
                "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
        })
@ConditionalOnClass(DeliveryPublisher.class)
@ConditionalOnProperty(prefix = "evreg.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ObservabilityProperties.class)
public class ObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "evreg.observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public DeliveryMetrics deliveryMetrics(MeterRegistry registry, Environment env, ObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new DeliveryMetrics(registry, app, props);
    }

    /**
     * Register base meters and gauges at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle deliveryMetricsPreRegisterLifecycle(
            ObservabilityProperties props,
            Environment env,
            ObjectProvider<DeliveryMetrics> metricsProvider,
            ObjectProvider<MeterRegistry> registryProvider,
            ObjectProvider<CircuitBreaker> breakerProvider,
            ObjectProvider<Bulkhead> bulkheadProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                running = true;
                if (!props.isMetricsEnabled()) return;

                DeliveryMetrics m = metricsProvider.getIfAvailable();
                if (m != null) m.preRegisterBaseMeters();

                MeterRegistry registry = registryProvider.getIfAvailable();
                if (registry != null) {
                    String app = env.getProperty("spring.application.name", "unknown-service");
                    new DeliveryGauges(app, breakerProvider.getIfAvailable(), bulkheadProvider.getIfAvailable())
                            .bindTo(registry);
                }
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; } // start very early
        };
    }

    @Bean
    public static BeanPostProcessor observingDeliveryPublisherBpp(ObjectProvider<ObservabilityProperties> propsProvider) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof DeliveryPublisher publisher)) return bean;
                if (bean instanceof ObservingDeliveryPublisher) return bean;

                ObservabilityProperties props = propsProvider.getIfAvailable(ObservabilityProperties::new);
                if (!props.isEnabled()) return bean;
                return new ObservingDeliveryPublisher(publisher, props);
            }
        };
    }
}
