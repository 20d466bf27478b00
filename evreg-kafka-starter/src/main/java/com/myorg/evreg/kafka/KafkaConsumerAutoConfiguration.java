package com.myorg.evreg.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(ConsumerFactory.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaConsumerAutoConfiguration {

    /**
     * Consumer factory for the dead-letter reprocessor. Values stay raw strings: the reader parses
     * them itself so a malformed dead letter can be quarantined instead of failing the poll.
     */
    @Bean
    @ConditionalOnMissingBean(name = "deadLetterConsumerFactory")
    public ConsumerFactory<String, String> deadLetterConsumerFactory(KafkaProperties props) {
        Map<String, Object> c = new HashMap<>();
        c.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());
        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        c.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, props.getConsumer().getMaxPollRecords());
        // reprocessor tự commit sau mỗi record
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getConsumer().getAutoOffsetReset());
        c.put(ConsumerConfig.METADATA_MAX_AGE_CONFIG, props.getConsumer().getMetadataMaxAgeMs());

        if (StringUtils.hasText(props.getConsumer().getGroupId())) {
            c.put(ConsumerConfig.GROUP_ID_CONFIG, props.getConsumer().getGroupId());
        }
        return new DefaultKafkaConsumerFactory<>(c);
    }
}
