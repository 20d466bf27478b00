package com.myorg.evreg.delivery.fallback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evreg.contracts.core.envelope.DeadLetterRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * One JSON file per record, named after the correlation id. Existing files are never overwritten:
 * a second record with the same id gets {@code <id>-1.json}, then {@code <id>-2.json}, and so on.
 */
@Slf4j
public class LocalFileFallbackStore implements FallbackStore {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
    private static final int MAX_NAME = 200;
    private static final int MAX_SUFFIX = 10_000;
    private static final String EXT = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;

    public LocalFileFallbackStore(Path directory, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Optional<Path> store(String targetTopic, DeadLetterRecord record, String reason, Throwable error) {
        String corrId = record == null ? null : record.correlationId();
        try {
            FallbackEntry entry = new FallbackEntry(clock.instant(), targetTopic, reason, DeadLetterRecord.describe(error), record);
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(entry);

            Files.createDirectories(directory);
            String base = baseName(corrId);
            for (int i = 0; i < MAX_SUFFIX; i++) {
                Path file = directory.resolve(i == 0 ? base + EXT : base + "-" + i + EXT);
                try {
                    write(file, json);
                } catch (FileAlreadyExistsException taken) {
                    continue;
                }
                log.error("Stored undeliverable record in fallback file={} target={} corrId={} reason={}",
                        file, targetTopic, corrId, reason);
                return Optional.of(file);
            }
            log.error("Fallback write FAILED: no free file name for base={} in dir={}", base, directory);
            return Optional.empty();
        } catch (Exception e) {
            log.error("Fallback write FAILED target={} corrId={} dir={}", targetTopic, corrId, directory, e);
            return Optional.empty();
        }
    }

    @Override
    public List<StoredFallback> list() {
        if (!Files.isDirectory(directory)) return List.of();

        List<StoredFallback> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(EXT))
                    .filter(Files::isRegularFile)
                    .forEach(p -> {
                        try {
                            out.add(new StoredFallback(p, mapper.readValue(p.toFile(), FallbackEntry.class)));
                        } catch (IOException e) {
                            log.warn("Skipping unreadable fallback file={} error={}", p, e.toString());
                        }
                    });
        } catch (IOException e) {
            log.error("Cannot list fallback dir={}", directory, e);
            return List.of();
        }

        out.sort(Comparator
                .comparing((StoredFallback s) -> s.entry().timestamp(), Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(s -> s.file().getFileName().toString()));
        return out;
    }

    @Override
    public boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Cannot delete fallback file={}", file, e);
            return false;
        }
    }

    public Path getDirectory() {
        return directory;
    }

    private static void write(Path file, byte[] json) throws IOException {
        try {
            Files.write(file, json, CREATE_NEW, WRITE);
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (IOException e) {
            // không để lại file ghi dở, list() sẽ vấp
            Files.deleteIfExists(file);
            throw e;
        }
    }

    static String baseName(String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String safe = UNSAFE.matcher(correlationId.trim()).replaceAll("_");
        return safe.length() > MAX_NAME ? safe.substring(0, MAX_NAME) : safe;
    }
}
