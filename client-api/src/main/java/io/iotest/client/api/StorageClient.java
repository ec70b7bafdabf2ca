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
package io.iotest.client.api;

import io.iotest.client.api.exceptions.BackendException;
import lombok.NonNull;

/**
 * Lifecycle and key-generation side of a storage backend under test.
 *
 * <p>Implementations hold mutable state (typically a key counter) and are <b>not</b> thread-safe.
 * Callers must serialize every call to {@link #genUniqueKey()}. Operations on keys go through the
 * {@link StorageClientHandler} returned by {@link #handler()}, which may be shared freely across
 * threads.
 */
public interface StorageClient {

    /**
     * Performs one-time setup, such as creating the namespace the keys live in. Calling it more
     * than once has no further effect.
     *
     * @throws BackendException the backend could not be prepared. No operation can succeed
     *     afterwards, so callers should treat this as fatal.
     */
    void init() throws BackendException;

    /**
     * Generates a key that this instance has never returned before.
     *
     * @return A fresh key.
     */
    @NonNull
    String genUniqueKey();

    /**
     * Returns the operation handler for this backend. The handler is stateless and reentrant; a
     * single instance may be shared by any number of concurrent callers.
     *
     * @return The handler.
     */
    @NonNull
    StorageClientHandler handler();
}
