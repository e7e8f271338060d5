package me.golemcore.agentcore.port.outbound;

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
 * Port for text files inside the local workspace, organized by directory
 * (conversations, prompts). Supports plain, append-only (JSONL) and atomic
 * writes.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     *
     * @param directory
     *            subdirectory (e.g., "conversations", "prompts")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file. Completes with null when the file is absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix, as paths relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL logs).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Write text through a temporary file and an atomic rename, optionally keeping
     * the previous version as {@code .bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> ensureDirectory(String directory);
}
