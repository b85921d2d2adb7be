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
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Runs storage operations with exponential backoff. Writes are retried since
 * durability is non-negotiable; reads are attempted once and surface
 * {@link StorageUnavailableException} so callers can degrade.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageRetrySupport {

    private final MemoryProperties properties;

    public void write(String description, Supplier<CompletableFuture<Void>> operation) {
        MemoryProperties.RetryProperties retry = properties.getRetry();
        long maxRetries = Math.max(0, retry.getStorageMaxAttempts() - 1L);
        Mono.defer(() -> Mono.fromFuture(operation.get()))
                .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(retry.getStorageFirstBackoffMs()))
                        .doBeforeRetry(signal -> log.warn(
                                "[Storage] Retrying {} (attempt {}): {}",
                                description, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> new StorageUnavailableException(
                                "Storage write failed after retries: " + description, signal.failure())))
                .onErrorMap(e -> !(e instanceof StorageUnavailableException),
                        e -> new StorageUnavailableException("Storage write failed: " + description, e))
                .block();
    }

    public <T> T read(String description, Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StorageUnavailableException("Storage read failed: " + description, cause);
        }
    }
}
