package com.myorg.evreg.delivery.reprocess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import com.myorg.evreg.contracts.core.spi.BrokerClient;
import com.myorg.evreg.delivery.autoconfig.DeliveryAutoConfiguration;
import com.myorg.evreg.delivery.support.FakeBrokerClient;
import org.aopalliance.intercept.MethodInterceptor;
import org.junit.jupiter.api.Test;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Recovery methods must be found on beans wrapped by AOP (transactions, tracing...): scanning
 * {@code bean.getClass()} of a CGLIB proxy would miss the annotations of the target class.
 */
class ProxySafeRecoveryScanningTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DeliveryAutoConfiguration.class))
            .withPropertyValues("evreg.delivery.fallback.directory=target/fallback-scan-test");

    @Test
    void registers_recovery_method_of_a_proxied_bean_and_converts_the_payload() {
        runner.withUserConfiguration(TestConfig.class)
                .run(ctx -> {
                    RecoveryHandlerRegistry registry = ctx.getBean(RecoveryHandlerRegistry.class);
                    assertThat(registry.topics()).containsExactlyInAnyOrder("demo.created", "demo.updated");

                    ObjectNode payload = JsonNodeFactory.instance.objectNode().put("id", "d-1");
                    DeadLetterRecord record = new DeadLetterRecord("demo.created", payload, "x",
                            ErrorKind.TRANSIENT, 0, Instant.EPOCH, Instant.EPOCH, "c-1");

                    registry.get("demo.created").recover(payload, record);
                    registry.get("demo.updated").recover(payload, record);

                    TestConfig.DemoRecovery target = ctx.getBean(TestConfig.DemoRecovery.class);
                    assertThat(target.seen()).containsExactly("created:d-1", "updated:d-1@0");
                });
    }

    @Configuration
    static class TestConfig {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        BrokerClient brokerClient() {
            return new FakeBrokerClient();
        }

        @Bean
        static BeanPostProcessor proxyingPostProcessor() {
            return new BeanPostProcessor() {
                @Override
                public Object postProcessAfterInitialization(Object bean, String beanName) {
                    if (bean instanceof DemoRecovery) {
                        ProxyFactory pf = new ProxyFactory(bean);
                        pf.setProxyTargetClass(true);
                        pf.addAdvice((MethodInterceptor) invocation -> invocation.proceed());
                        return pf.getProxy();
                    }
                    return bean;
                }
            };
        }

        @Component
        static class DemoRecovery {
            private final List<String> seen = new CopyOnWriteArrayList<>();

            public List<String> seen() {
                return seen;
            }

            @DeadLetterRecovery(value = "demo.created", payload = DemoPayload.class)
            public void created(DemoPayload payload) {
                seen.add("created:" + payload.id);
            }

            @DeadLetterRecovery(value = "demo.updated", payload = DemoPayload.class)
            public void updated(DeadLetterRecord record, DemoPayload payload) {
                seen.add("updated:" + payload.id + "@" + record.retryCount());
            }
        }
    }

    static class DemoPayload {
        public String id;
    }
}
