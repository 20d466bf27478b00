package com.myorg.evreg.kafka;

import com.myorg.evreg.contracts.core.conventions.DeadLetterTopics;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaAdmin;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaAutoConfiguration {

    // Marker bean: để test check starter đã load + properties đã bind
    public record EvregKafkaMarker(String bootstrapServers, String dlqPrefix) {}

    @Bean
    @ConditionalOnMissingBean
    public EvregKafkaMarker evregKafkaMarker(KafkaProperties props) {
        return new EvregKafkaMarker(props.getBootstrapServers(), props.getDlq().getPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterTopics deadLetterTopics(KafkaProperties props) {
        return new DeadLetterTopics(props.getDlq().getPrefix(), props.getDlq().getPermanentSuffix());
    }

    /**
     * KafkaAdmin wired to evreg.kafka.bootstrap-servers so NewTopic beans can be applied.
     * (Spring Boot's default KafkaAdmin reads spring.kafka.bootstrap-servers, which we don't use.)
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(KafkaProperties props) {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        return new KafkaAdmin(cfg);
    }
}
