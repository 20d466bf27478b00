package com.myorg.evreg.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.core.envelope.DeliveryJson;
import com.myorg.evreg.contracts.core.spi.BrokerClient;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(before = org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class)
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(KafkaProperties.class)
public class KafkaProducerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProducerFactory<String, Object> producerFactory(KafkaProperties props,
                                                           ObjectProvider<ObjectMapper> mapperProvider) {
        Map<String, Object> p = new HashMap<>();
        p.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, props.getBootstrapServers());

        // mặc định an toàn (acks=all, idempotent)
        p.put(ProducerConfig.ACKS_CONFIG, props.getProducer().getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, props.getProducer().isIdempotence());
        p.put(ProducerConfig.RETRIES_CONFIG, props.getProducer().getRetries());
        p.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, props.getProducer().getMaxInFlight());
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, props.getProducer().getCompression());
        p.put(ProducerConfig.LINGER_MS_CONFIG, props.getProducer().getLingerMs());
        p.put(ProducerConfig.BATCH_SIZE_CONFIG, props.getProducer().getBatchSize());

        // giới hạn thời gian chờ: broker chết thì ra timeout, không treo caller
        p.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, props.getProducer().getMaxBlockMs());
        p.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, props.getProducer().getRequestTimeoutMs());
        p.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, props.getProducer().getDeliveryTimeoutMs());

        ObjectMapper mapper = mapperProvider.getIfAvailable(DeliveryJson::defaultMapper);
        JsonSerializer<Object> valueSerializer = new JsonSerializer<Object>(mapper).noTypeInfo();
        return new DefaultKafkaProducerFactory<>(p, new StringSerializer(), valueSerializer);
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> pf) {
        return new KafkaTemplate<>(pf);
    }

    @Bean
    @ConditionalOnMissingBean(BrokerClient.class)
    public KafkaBrokerClient kafkaBrokerClient(KafkaTemplate<String, Object> template, Environment env) {
        String service = env.getProperty("spring.application.name", "unknown-service");
        return new KafkaBrokerClient(template, service, Clock.systemUTC());
    }
}
