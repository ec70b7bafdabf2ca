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

import io.iotest.client.api.StorageClient;
import io.iotest.client.api.StorageClientHandler;
import java.util.concurrent.ConcurrentHashMap;
import lombok.NonNull;

/** Keeps every record in a concurrent map. Useful as a zero-latency baseline. */
public final class InMemoryStorageClient implements StorageClient {
    private final InMemoryStorageClientHandler handler =
            new InMemoryStorageClientHandler(new ConcurrentHashMap<>());
    private long autoIncrement;

    @Override
    public void init() {}

    @Override
    public @NonNull String genUniqueKey() {
        return "mem-" + autoIncrement++;
    }

    @Override
    public @NonNull StorageClientHandler handler() {
        return handler;
    }
}
