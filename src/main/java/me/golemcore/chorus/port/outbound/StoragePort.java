package me.golemcore.chorus.port.outbound;

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
 * Port for local persistence of small text documents.
 */
public interface StoragePort {

    /**
     * Reads a text file, completing with {@code null} if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Writes via a temporary file and an atomic move, optionally keeping the
     * previous version as {@code <path>.bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
