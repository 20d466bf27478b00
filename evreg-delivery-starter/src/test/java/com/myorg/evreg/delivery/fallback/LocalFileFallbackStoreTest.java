package com.myorg.evreg.delivery.fallback;

import com.fasterxml.jackson.databind.node.IntNode;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evreg.contracts.core.envelope.DeliveryJson;
import com.myorg.evreg.contracts.core.exception.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class LocalFileFallbackStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private static DeadLetterRecord record(String corrId) {
        return DeadLetterRecord.first("event.created", IntNode.valueOf(1), new TimeoutException("down"),
                ErrorKind.TRANSIENT, corrId, 0, T0);
    }

    private LocalFileFallbackStore storeAt(Instant now) {
        return new LocalFileFallbackStore(dir, DeliveryJson.defaultMapper(), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void writes_one_json_file_named_after_the_correlation_id() throws Exception {
        Path file = storeAt(T0).store("dlq.event.created", record("event-42"), "delivery-failed",
                new TimeoutException("down")).orElseThrow();

        assertThat(file.getFileName().toString()).isEqualTo("event-42.json");
        String json = Files.readString(file);
        assertThat(json).contains("\"target_topic\"", "\"reason\" : \"delivery-failed\"", "\"retry_count\" : 0",
                "TimeoutException: down");
    }

    @Test
    void never_overwrites_an_existing_file() {
        LocalFileFallbackStore store = storeAt(T0);

        Path a = store.store("dlq.event.created", record("event-42"), "r", null).orElseThrow();
        Path b = store.store("dlq.event.created", record("event-42"), "r", null).orElseThrow();
        Path c = store.store("dlq.event.created", record("event-42"), "r", null).orElseThrow();

        assertThat(List.of(a, b, c)).extracting(p -> p.getFileName().toString())
                .containsExactly("event-42.json", "event-42-1.json", "event-42-2.json");
        assertThat(store.list()).hasSize(3);
    }

    @Test
    void unsafe_or_missing_ids_still_give_a_file_inside_the_directory() {
        LocalFileFallbackStore store = storeAt(T0);

        Path unsafe = store.store("t", record("../../etc/passwd"), "r", null).orElseThrow();
        Path none = store.store("t", record(null), "r", null).orElseThrow();

        assertThat(unsafe.getParent()).isEqualTo(dir);
        assertThat(unsafe.getFileName().toString()).isEqualTo(".._.._etc_passwd.json");
        assertThat(none.getParent()).isEqualTo(dir);
    }

    @Test
    void lists_oldest_first_and_skips_garbage() throws Exception {
        storeAt(T0.plusSeconds(60)).store("t", record("b"), "r", null);
        storeAt(T0).store("t", record("a"), "r", null);
        Files.writeString(dir.resolve("broken.json"), "{not json");

        List<StoredFallback> listed = storeAt(T0).list();

        assertThat(listed).extracting(s -> s.entry().record().correlationId()).containsExactly("a", "b");
        assertThat(listed.get(0).entry().targetTopic()).isEqualTo("t");
    }

    @Test
    void reports_failure_instead_of_throwing_when_the_directory_cannot_be_used() throws Exception {
        Path notADir = Files.writeString(dir.resolve("occupied"), "x");
        LocalFileFallbackStore store = new LocalFileFallbackStore(notADir, DeliveryJson.defaultMapper(), Clock.systemUTC());

        assertThat(store.store("t", record("x"), "r", null)).isEmpty();
        assertThat(store.list()).isEmpty();
    }

    @Test
    void delete_removes_the_file() {
        LocalFileFallbackStore store = storeAt(T0);
        Path file = store.store("t", record("x"), "r", null).orElseThrow();

        assertThat(store.delete(file)).isTrue();
        assertThat(store.delete(file)).isFalse();
        assertThat(store.list()).isEmpty();
    }
}
