package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryEngineException;
import me.golemcore.memory.domain.model.ArchiveResult;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.EventQuery;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Append-only ledger of events.
 *
 * <p>
 * Events are stored as JSON lines partitioned per user and UTC month
 * ({@code events/<user>/<yyyy-MM>.jsonl}). Queries stream partition by
 * partition so a decade of history is never loaded at once. There is no update
 * or delete; {@link #archive} only moves whole lines, unchanged, into
 * gzip-compressed cold partitions under {@code archive/}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventStoreService {

    private static final String EVENTS_DIR = "events";
    private static final String ARCHIVE_DIR = "archive";
    private static final String HOT_EXTENSION = ".jsonl";
    private static final String ARCHIVE_EXTENSION = ".jsonl.gz";
    private static final int MONTH_LENGTH = "yyyy-MM".length();

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;
    private final EventValidator eventValidator;
    private final Clock clock;

    private final Map<String, ReentrantLock> partitionLocks = new ConcurrentHashMap<>();

    /**
     * Validates and appends one event.
     *
     * @return the event id, generated when the event had none
     */
    public String append(Event event) {
        return store(event).getEventId();
    }

    /**
     * Validates every event first, then appends them. Nothing is written if any
     * event is invalid.
     */
    public List<Event> appendAll(List<Event> events) {
        List<Event> normalized = events.stream().map(this::normalize).toList();
        normalized.forEach(eventValidator::validate);
        normalized.forEach(this::write);
        return normalized;
    }

    public Event store(Event event) {
        Event normalized = normalize(event);
        eventValidator.validate(normalized);
        write(normalized);
        return normalized;
    }

    public Stream<Event> query(EventQuery query) {
        eventValidator.validateUserId(query.getUserId());
        Stream<Event> events = listPartitions(query.getUserId(), query.isIncludeArchived()).stream()
                .filter(partition -> partition.overlaps(query.getFrom(), query.getTo()))
                .flatMap(partition -> readPartition(partition).stream())
                .filter(query::matches);
        if (query.getLimit() != null) {
            events = events.limit(query.getLimit());
        }
        return events;
    }

    public List<Event> findByIds(String userId, Collection<String> eventIds) {
        if (eventIds.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new HashSet<>(eventIds);
        try (Stream<Event> events = query(EventQuery.builder().userId(userId).includeArchived(true).build())) {
            return events.filter(event -> wanted.contains(event.getEventId())).toList();
        }
    }

    public long count(String userId) {
        try (Stream<Event> events = query(EventQuery.builder().userId(userId).includeArchived(true).build())) {
            return events.count();
        }
    }

    /**
     * Users that have at least one hot event partition.
     */
    public List<String> knownUsers() {
        List<String> files = storageRetry.read("list event partitions",
                () -> storagePort.listObjects(EVENTS_DIR, ""));
        return files.stream()
                .filter(file -> file.indexOf('/') > 0)
                .map(file -> file.substring(0, file.indexOf('/')))
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Moves events with a timestamp before {@code olderThan} into cold storage.
     * Lines are copied verbatim, so archived events read back identical.
     */
    public ArchiveResult archive(String userId, Instant olderThan) {
        eventValidator.validateUserId(userId);
        int archived = 0;
        int touched = 0;
        for (Partition partition : listPartitions(userId, false)) {
            if (!partition.startsBefore(olderThan)) {
                continue;
            }
            int moved = withPartitionLock(partition.path(), () -> archivePartition(userId, partition, olderThan));
            if (moved > 0) {
                archived += moved;
                touched++;
            }
        }
        if (archived > 0) {
            log.info("[EventStore] Archived {} event(s) of user {} from {} partition(s)", archived, userId, touched);
        }
        return new ArchiveResult(userId, archived, touched);
    }

    private int archivePartition(String userId, Partition partition, Instant olderThan) {
        String content = storageRetry.read("read " + partition.path(),
                () -> storagePort.getText(EVENTS_DIR, partition.path()));
        List<String> moved = new ArrayList<>();
        List<String> kept = new ArrayList<>();
        JsonlCodec.lines(content).forEach(line -> {
            Event event = jsonlCodec.parseLine(line, Event.class, partition.path());
            if (event != null && event.getTimestamp().isBefore(olderThan)) {
                moved.add(line);
            } else {
                kept.add(line);
            }
        });
        if (moved.isEmpty()) {
            return 0;
        }

        String archivePath = nextArchivePath(userId, partition.month());
        byte[] compressed = gzip(joinLines(moved));
        storageRetry.write("write " + archivePath, () -> storagePort.putObject(ARCHIVE_DIR, archivePath, compressed));
        if (kept.isEmpty()) {
            storageRetry.write("delete " + partition.path(),
                    () -> storagePort.deleteObject(EVENTS_DIR, partition.path()));
        } else {
            String remaining = joinLines(kept);
            storageRetry.write("rewrite " + partition.path(),
                    () -> storagePort.putTextAtomic(EVENTS_DIR, partition.path(), remaining, false));
        }
        log.debug("[EventStore] Moved {} event(s) from {} to {}", moved.size(), partition.path(), archivePath);
        return moved.size();
    }

    private void write(Event event) {
        String path = partitionPath(event.getUserId(), event.getTimestamp());
        String line = jsonlCodec.toLine(event);
        withPartitionLock(path, () -> {
            storageRetry.write("append event to " + path, () -> storagePort.appendText(EVENTS_DIR, path, line));
            return null;
        });
        log.debug("[EventStore] Appended event {} ({} {}) for user {}", event.getEventId(), event.getAction(),
                event.getTarget(), event.getUserId());
    }

    private Event normalize(Event event) {
        if (event == null) {
            return null;
        }
        Event.EventBuilder builder = event.toBuilder();
        if (event.getEventId() == null || event.getEventId().isBlank()) {
            builder.eventId(UUID.randomUUID().toString());
        }
        if (event.getActor() == null || event.getActor().isBlank()) {
            builder.actor(Event.SELF_ACTOR);
        }
        builder.action(trimToNull(event.getAction()));
        builder.target(trimToNull(event.getTarget()));
        builder.unit(trimToNull(event.getUnit()));
        return builder.build();
    }

    private List<Partition> listPartitions(String userId, boolean includeArchived) {
        List<Partition> partitions = new ArrayList<>();
        for (String file : storageRetry.read("list events of " + userId,
                () -> storagePort.listObjects(EVENTS_DIR, userId))) {
            toPartition(file, false).ifPresent(partitions::add);
        }
        if (includeArchived) {
            for (String file : storageRetry.read("list archive of " + userId,
                    () -> storagePort.listObjects(ARCHIVE_DIR, userId))) {
                toPartition(file, true).ifPresent(partitions::add);
            }
        }
        partitions.sort(Comparator.comparing(Partition::month)
                .thenComparing(partition -> !partition.archived())
                .thenComparing(Partition::path));
        return partitions;
    }

    private Optional<Partition> toPartition(String file, boolean archived) {
        String extension = archived ? ARCHIVE_EXTENSION : HOT_EXTENSION;
        String name = file.substring(file.lastIndexOf('/') + 1);
        if (!name.endsWith(extension) || name.length() < MONTH_LENGTH) {
            return Optional.empty();
        }
        try {
            YearMonth month = YearMonth.parse(name.substring(0, MONTH_LENGTH));
            return Optional.of(new Partition(file, month, archived));
        } catch (DateTimeParseException e) {
            log.debug("[EventStore] Ignoring unexpected file {}", file);
            return Optional.empty();
        }
    }

    private List<Event> readPartition(Partition partition) {
        String content;
        if (partition.archived()) {
            byte[] compressed = storageRetry.read("read " + partition.path(),
                    () -> storagePort.getObject(ARCHIVE_DIR, partition.path()));
            content = compressed == null ? null : gunzip(compressed);
        } else {
            content = storageRetry.read("read " + partition.path(),
                    () -> storagePort.getText(EVENTS_DIR, partition.path()));
        }
        return jsonlCodec.parseLines(content, Event.class, partition.path());
    }

    private String nextArchivePath(String userId, YearMonth month) {
        String base = userId + "/" + month + "-" + clock.millis();
        String candidate = base + ARCHIVE_EXTENSION;
        for (int suffix = 1; archiveExists(candidate); suffix++) {
            candidate = base + "-" + suffix + ARCHIVE_EXTENSION;
        }
        return candidate;
    }

    private boolean archiveExists(String path) {
        return Boolean.TRUE.equals(storageRetry.read("check " + path, () -> storagePort.exists(ARCHIVE_DIR, path)));
    }

    private <T> T withPartitionLock(String path, Supplier<T> action) {
        ReentrantLock lock = partitionLocks.computeIfAbsent(path, p -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    static String partitionPath(String userId, Instant timestamp) {
        return userId + "/" + YearMonth.from(timestamp.atZone(ZoneOffset.UTC)) + HOT_EXTENSION;
    }

    private static String joinLines(List<String> lines) {
        return lines.stream().collect(Collectors.joining("\n", "", "\n"));
    }

    private static byte[] gzip(String content) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(buffer)) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MemoryEngineException("Failed to compress archive partition", e);
        }
        return buffer.toByteArray();
    }

    private static String gunzip(byte[] compressed) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MemoryEngineException("Failed to decompress archive partition", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record Partition(String path, YearMonth month, boolean archived) {

        boolean overlaps(Instant from, Instant to) {
            Instant start = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            Instant end = month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            return (to == null || start.isBefore(to)) && (from == null || end.isAfter(from));
        }

        boolean startsBefore(Instant instant) {
            return month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant().isBefore(instant);
        }
    }
}
