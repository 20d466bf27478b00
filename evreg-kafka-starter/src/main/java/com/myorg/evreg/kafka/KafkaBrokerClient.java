package com.myorg.evreg.kafka;

import com.myorg.evreg.contracts.core.conventions.DeliveryHeaders;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.spi.BrokerAck;
import com.myorg.evreg.contracts.core.spi.BrokerClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking {@link BrokerClient} over {@link KafkaTemplate}. The correlation id is both the record key
 * and the {@code evreg-correlation-id} header; dead-letter records additionally carry
 * {@code evreg.dlq.*} headers so they can be inspected without parsing the value.
 */
@Slf4j
public class KafkaBrokerClient implements BrokerClient {

    private final KafkaTemplate<String, Object> template;
    private final String service;
    private final Clock clock;

    public KafkaBrokerClient(KafkaTemplate<String, Object> template, String service, Clock clock) {
        this.template = template;
        this.service = service;
        this.clock = clock;
    }

    @Override
    public BrokerAck send(String topic, String key, Object value, Duration timeout) throws Exception {
        ProducerRecord<String, Object> record = new ProducerRecord<>(topic, key, value);
        Headers headers = record.headers();
        if (key != null) {
            putHeader(headers, DeliveryHeaders.CORRELATION_ID, key);
        }
        if (value instanceof DeadLetterRecord dlr) {
            putHeader(headers, DeliveryHeaders.ORIGINAL_TOPIC, dlr.originalTopic());
            putHeader(headers, DeliveryHeaders.ERROR_KIND, dlr.errorKind() == null ? "" : dlr.errorKind().name());
            putHeader(headers, DeliveryHeaders.RETRY_COUNT, String.valueOf(dlr.retryCount()));
            putHeader(headers, DeliveryHeaders.SERVICE, service);
            putHeader(headers, DeliveryHeaders.TS_MS, String.valueOf(clock.millis()));
        }

        CompletableFuture<SendResult<String, Object>> future = template.send(record);
        try {
            SendResult<String, Object> result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            RecordMetadata md = result == null ? null : result.getRecordMetadata();
            if (md == null) return BrokerAck.unknown(topic);
            return new BrokerAck(md.topic(), md.partition(), md.offset());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        } catch (TimeoutException e) {
            // stop waiting; the producer may still complete the send in the background
            future.cancel(true);
            log.debug("Send timed out topic={} key={} after {}ms", topic, key, timeout.toMillis());
            throw e;
        }
    }

    private static void putHeader(Headers headers, String key, String value) {
        headers.remove(key);
        headers.add(key, (value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
    }
}
