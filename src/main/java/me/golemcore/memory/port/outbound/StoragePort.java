package me.golemcore.memory.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable storage of the memory workspace. Files are organized by
 * directory (events, entities, views, concepts, audit, ...) and partitioned by
 * user id inside each directory. Supports append-only JSONL writes for ledgers
 * and crash-safe atomic replacement for snapshot files.
 */
public interface StoragePort {

    /**
     * Write binary content to file, replacing any previous content.
     *
     * @param directory
     *            top-level directory (e.g., "events", "archive")
     * @param path
     *            relative path within directory
     * @param content
     *            binary content
     */
    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    /**
     * Read binary content from file, or {@code null} when the file is absent.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Read text content from file, or {@code null} when the file is absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files below {@code directory/prefix}, relative to {@code directory},
     * in lexicographic order.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file, creating it when missing. Used for JSONL ledgers.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically replace a file: write to a temporary sibling, fsync, optionally
     * keep the previous version as {@code .bak}, then rename over the target.
     *
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
