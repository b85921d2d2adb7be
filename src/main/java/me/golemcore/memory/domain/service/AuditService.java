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
import me.golemcore.memory.domain.model.AuditEntry;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Append-only log of every crossing of the consumer boundary, one JSONL file
 * per user under {@code audit/}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private static final String AUDIT_DIR = "audit";
    static final String SYSTEM_USER = "_system";

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;
    private final Clock clock;

    public AuditEntry record(String userId, String consumerId, String operation, String target, boolean success,
            int resultSize, String errorMessage) {
        AuditEntry entry = AuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .userId(userId)
                .consumerId(consumerId)
                .operation(operation)
                .target(target)
                .timestamp(clock.instant())
                .success(success)
                .resultSize(resultSize)
                .errorMessage(errorMessage)
                .build();
        String path = fileOf(userId);
        String line = jsonlCodec.toLine(entry);
        storageRetry.write("append audit entry", () -> storagePort.appendText(AUDIT_DIR, path, line));
        log.debug("[Audit] {} {} {} by {} (success={}, size={})", operation, userId, target, consumerId, success,
                resultSize);
        return entry;
    }

    public List<AuditEntry> list(String userId) {
        String path = fileOf(userId);
        String content = storageRetry.read("read audit log", () -> storagePort.getText(AUDIT_DIR, path));
        return jsonlCodec.parseLines(content, AuditEntry.class, AUDIT_DIR + "/" + path);
    }

    // Entries whose user id was rejected by validation go to a shared file.
    private static String fileOf(String userId) {
        if (userId == null || userId.isBlank() || userId.startsWith(".") || userId.contains("/")
                || userId.contains("\\")) {
            return SYSTEM_USER + ".jsonl";
        }
        return userId + ".jsonl";
    }
}
