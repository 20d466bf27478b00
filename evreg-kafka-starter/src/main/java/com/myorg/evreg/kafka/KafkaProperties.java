package com.myorg.evreg.kafka;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "evreg.kafka")
public class KafkaProperties {
    private String bootstrapServers;
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Dlq dlq = new Dlq();

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private int retries = 3;
        private int maxInFlight = 5;
        private String compression = "snappy";
        private int lingerMs = 5;
        private int batchSize = 65536;
        // send() được block bao lâu khi chờ metadata / buffer đầy
        private int maxBlockMs = 10_000;
        private int requestTimeoutMs = 5_000;
        // trần cho retry nội bộ của client, phải >= linger-ms + request-timeout-ms
        private int deliveryTimeoutMs = 10_000;
    }

    @Data
    public static class Consumer {
        //group của dead-letter reprocessor
        private String groupId = "dlq-processor-group";
        private String autoOffsetReset = "earliest";
        private int maxPollRecords = 100;
        // cũng là thời gian tối đa để pattern subscription thấy topic DLQ mới tạo
        private int metadataMaxAgeMs = 30_000;
    }

    @Data
    public static class Dlq {
        private String prefix = "dlq.";
        private String permanentSuffix = ".permanent";
    }
}
