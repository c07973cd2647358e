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

package me.golemcore.reasoning.port.outbound;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Snapshot files under the local workspace, addressed by a workspace
 * subdirectory and a file name inside it. Failures complete the returned future
 * exceptionally with a {@code PersistenceException}; paths escaping the
 * workspace fail with {@link IllegalArgumentException}.
 */
public interface StoragePort {

    /**
     * @return the file content, or empty when the file does not exist
     */
    CompletableFuture<Optional<String>> read(String directory, String file);

    /**
     * Replaces the file so that readers see either the old or the new content.
     * The previous version is kept as {@code <file>.bak}.
     */
    CompletableFuture<Void> writeAtomic(String directory, String file, String content);

    CompletableFuture<Void> ensureDirectory(String directory);
}
