/*
 * Copyright © 2022-2024 StreamNative Inc.
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
 */
package io.iotest.client.localfs;

import io.iotest.client.api.StorageClient;
import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores every key as a file directly under a prefix directory. A key is the absolute path of its
 * file.
 *
 * <p>Not thread-safe: {@link #genUniqueKey()} advances an unsynchronized counter.
 */
@Slf4j
public final class LocalFsStorageClient implements StorageClient {
    @Getter private final Path prefix;
    private long autoIncrement;

    public LocalFsStorageClient(@NonNull Path prefix) {
        this.prefix = prefix.toAbsolutePath();
        log.info("init local filesystem client. prefix={}", this.prefix);
    }

    @Override
    public void init() throws BackendException {
        if (Files.isDirectory(prefix)) {
            return;
        }
        try {
            Files.createDirectories(prefix);
        } catch (IOException ex) {
            throw new BackendException("init", prefix.toString(), ex);
        }
    }

    @Override
    public @NonNull String genUniqueKey() {
        return prefix.resolve(Long.toString(autoIncrement++)).toString();
    }

    @Override
    public @NonNull StorageClientHandler handler() {
        return LocalFsStorageClientHandler.INSTANCE;
    }
}
