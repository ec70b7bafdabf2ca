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

import static java.nio.charset.StandardCharsets.UTF_8;

import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import io.iotest.client.api.exceptions.KeyNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.NonNull;

final class LocalFsStorageClientHandler implements StorageClientHandler {
    static final LocalFsStorageClientHandler INSTANCE = new LocalFsStorageClientHandler();

    private LocalFsStorageClientHandler() {}

    @Override
    public void write(@NonNull String key, @NonNull String value) throws BackendException {
        try {
            Files.writeString(Path.of(key), value, UTF_8);
        } catch (IOException ex) {
            throw new BackendException("write", key, ex);
        }
    }

    @Override
    public @NonNull String read(@NonNull String key) throws BackendException {
        try {
            return Files.readString(Path.of(key), UTF_8);
        } catch (NoSuchFileException ex) {
            throw new KeyNotFoundException("read", key, ex);
        } catch (IOException ex) {
            throw new BackendException("read", key, ex);
        }
    }

    @Override
    public void delete(@NonNull String key) throws BackendException {
        try {
            Files.delete(Path.of(key));
        } catch (NoSuchFileException ex) {
            throw new KeyNotFoundException("delete", key, ex);
        } catch (IOException ex) {
            throw new BackendException("delete", key, ex);
        }
    }
}
