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
package io.iotest.perf;

import com.google.common.base.Ticker;
import io.iotest.client.api.StorageClient;
import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import io.iotest.client.memory.InMemoryStorageClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import lombok.NonNull;

/** In-memory client that records when each key was generated. */
final class RecordingStorageClient implements StorageClient {
    private final StorageClient delegate = new InMemoryStorageClient();
    private final Ticker ticker;
    private final List<Long> keyTimes = new ArrayList<>();
    private final AtomicInteger inits = new AtomicInteger();
    private IntConsumer onKey = index -> {};
    private StorageClientHandler handler;

    RecordingStorageClient(Ticker ticker) {
        this.ticker = ticker;
        this.handler = delegate.handler();
    }

    /** Runs after the key with the given zero-based index was generated. */
    RecordingStorageClient onKey(IntConsumer onKey) {
        this.onKey = onKey;
        return this;
    }

    RecordingStorageClient withHandler(StorageClientHandler handler) {
        this.handler = handler;
        return this;
    }

    StorageClientHandler delegateHandler() {
        return delegate.handler();
    }

    @Override
    public void init() throws BackendException {
        inits.incrementAndGet();
        delegate.init();
    }

    @Override
    public @NonNull String genUniqueKey() {
        keyTimes.add(ticker.read());
        final String key = delegate.genUniqueKey();
        onKey.accept(keyTimes.size() - 1);
        return key;
    }

    @Override
    public @NonNull StorageClientHandler handler() {
        return handler;
    }

    List<Long> keyTimes() {
        return keyTimes;
    }

    int inits() {
        return inits.get();
    }
}
