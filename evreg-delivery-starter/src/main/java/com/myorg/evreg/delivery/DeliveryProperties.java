package com.myorg.evreg.delivery;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "evreg.delivery")
public class DeliveryProperties {
    private boolean enabled = true;
    // mỗi kết nối broker: 1 breaker + 1 bulkhead
    private String breakerName = "kafka";
    // timeout cho mỗi lần gửi (chờ broker ack)
    private Duration sendTimeout = Duration.ofSeconds(10);
    // tổng thời gian 1 lần send, tính cả chờ bulkhead và retry. null = không giới hạn
    private Duration deliveryTimeout;

    private final Bulkhead bulkhead = new Bulkhead();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final Retry retry = new Retry();
    private final Fallback fallback = new Fallback();
    private final Reprocessor reprocessor = new Reprocessor();

    @Data
    public static class Bulkhead {
        private int maxConcurrent = 5;
        private int maxQueue = 50;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        // extra random delay, as a fraction of the backoff delay: [0, 1)
        private double jitter = 0.2;
    }

    @Data
    public static class Fallback {
        private String directory = "/tmp/event_fallback";
        private final Replay replay = new Replay();

        @Data
        public static class Replay {
            private boolean enabled = false;
            private boolean schedulingEnabled = true;
            private int batchSize = 100;
            private Duration interval = Duration.ofSeconds(60);
            private Duration initialDelay = Duration.ofSeconds(30);
        }
    }

    @Data
    public static class Reprocessor {
        private boolean enabled = false;
        //mặc định tắt: chỉ chạy khi operator gọi endpoint
        private boolean schedulingEnabled = false;
        // retry_count chạm ngưỡng này -> đẩy sang topic permanent
        private int maxRetries = 3;
        private int batchSize = 100;
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration initialDelay = Duration.ofSeconds(10);
        private final Idempotency idempotency = new Idempotency();
    }

    @Data
    public static class Idempotency {
        private boolean enabled = false;
        // memory | redis
        private String store = "memory";
        private Duration ttl = Duration.ofHours(24);
        // TTL cho lease đang recover, nên ngắn hơn ttl
        // (process chết giữa chừng thì lease tự hết hạn, dead letter được recover lại)
        private Duration processingTtl = Duration.ofMinutes(5);
        private int maxEntries = 500_000;
        private Duration cleanupInterval = Duration.ofMinutes(5);
        private String keyPrefix = "evreg:recovery:";
    }
}
