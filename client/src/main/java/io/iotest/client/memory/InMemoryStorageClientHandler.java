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
package io.iotest.client.memory;

import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.KeyNotFoundException;
import java.util.concurrent.ConcurrentMap;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class InMemoryStorageClientHandler implements StorageClientHandler {
    private final ConcurrentMap<String, String> records;

    @Override
    public void write(@NonNull String key, @NonNull String value) {
        records.put(key, value);
    }

    @Override
    public @NonNull String read(@NonNull String key) throws KeyNotFoundException {
        final String value = records.get(key);
        if (value == null) {
            throw new KeyNotFoundException("read", key);
        }
        return value;
    }

    @Override
    public void delete(@NonNull String key) throws KeyNotFoundException {
        if (records.remove(key) == null) {
            throw new KeyNotFoundException("delete", key);
        }
    }
}
