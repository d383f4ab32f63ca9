package me.golemcore.kernel.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage within the kernel workspace. Files are addressed
 * by a top-level directory ({@code audit}, {@code triggers}) and a relative
 * path inside it.
 */
public interface StoragePort {

    /**
     * Read text content. Completes with null when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Append one line to a file and force it to disk before completing. A
     * trailing newline is added when {@code line} does not end with one.
     *
     * <p>
     * Completion means the line is durable. The audit ledger relies on this to
     * publish an entry only after it has been persisted.
     */
    CompletableFuture<Void> appendLine(String directory, String path, String line);

    /**
     * Atomically replace a file's text content.
     *
     * <ol>
     * <li>Write to temporary file (.tmp suffix) and fsync</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     *
     * @param directory
     *            top-level directory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
