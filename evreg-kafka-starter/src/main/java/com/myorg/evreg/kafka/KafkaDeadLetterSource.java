package com.myorg.evreg.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.core.conventions.DeadLetterTopics;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.spi.DeadLetterSource;
import com.myorg.evreg.contracts.core.spi.ReceivedDeadLetter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads every dead-letter topic (pattern subscription, permanent topics excluded) with manual commits.
 * Records beyond the requested batch size are buffered for the next {@link #poll}.
 * Single-threaded, like the Kafka consumer it wraps.
 */
@Slf4j
public class KafkaDeadLetterSource implements DeadLetterSource {

    private final ConsumerFactory<String, String> consumerFactory;
    private final DeadLetterTopics topics;
    private final ObjectMapper mapper;

    private final Deque<ConsumerRecord<String, String>> buffered = new ArrayDeque<>();
    private Consumer<String, String> consumer;

    public KafkaDeadLetterSource(ConsumerFactory<String, String> consumerFactory,
                                 DeadLetterTopics topics,
                                 ObjectMapper mapper) {
        this.consumerFactory = consumerFactory;
        this.topics = topics;
        this.mapper = mapper;
    }

    @Override
    public List<ReceivedDeadLetter> poll(int maxRecords, Duration timeout) {
        if (buffered.isEmpty()) {
            for (ConsumerRecord<String, String> r : consumer().poll(timeout)) {
                buffered.add(r);
            }
        }
        List<ReceivedDeadLetter> out = new ArrayList<>();
        while (out.size() < maxRecords && !buffered.isEmpty()) {
            out.add(read(buffered.poll()));
        }
        return out;
    }

    @Override
    public void commit(ReceivedDeadLetter received) {
        TopicPartition tp = new TopicPartition(received.sourceTopic(), received.partition());
        consumer().commitSync(Map.of(tp, new OffsetAndMetadata(received.offset() + 1)));
    }

    @Override
    public void rewind() {
        buffered.clear();
        if (consumer == null) return;

        Set<TopicPartition> assigned = consumer.assignment();
        if (assigned.isEmpty()) return;

        Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(assigned);
        for (TopicPartition tp : assigned) {
            OffsetAndMetadata om = committed.get(tp);
            if (om == null) {
                consumer.seekToBeginning(List.of(tp));
            } else {
                consumer.seek(tp, om.offset());
            }
        }
        log.info("Rewound dead-letter consumer to committed offsets partitions={}", assigned.size());
    }

    @Override
    public void close() {
        buffered.clear();
        if (consumer != null) {
            consumer.close();
            consumer = null;
        }
    }

    private Consumer<String, String> consumer() {
        if (consumer == null) {
            consumer = consumerFactory.createConsumer();
            consumer.subscribe(topics.subscriptionPattern());
            log.info("Dead-letter consumer subscribed pattern={}", topics.subscriptionPattern().pattern());
        }
        return consumer;
    }

    private ReceivedDeadLetter read(ConsumerRecord<String, String> r) {
        String raw = r.value();
        if (raw == null || raw.isBlank()) {
            return ReceivedDeadLetter.unreadable(r.topic(), r.partition(), r.offset(), raw, "empty value");
        }
        try {
            DeadLetterRecord record = mapper.readValue(raw, DeadLetterRecord.class);
            return ReceivedDeadLetter.readable(r.topic(), r.partition(), r.offset(), record, raw);
        } catch (Exception e) {
            log.warn("Unreadable dead letter topic={} partition={} offset={} error={}",
                    r.topic(), r.partition(), r.offset(), e.toString());
            return ReceivedDeadLetter.unreadable(r.topic(), r.partition(), r.offset(), raw, e.toString());
        }
    }
}
