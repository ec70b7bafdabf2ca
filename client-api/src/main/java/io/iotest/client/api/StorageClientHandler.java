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
import io.iotest.client.api.exceptions.KeyNotFoundException;
import lombok.NonNull;

/** Stateless, concurrency-safe operations against a storage backend. */
public interface StorageClientHandler {

    /**
     * Associates a value with a key, creating the record or overwriting an existing one.
     *
     * @param key The key with which the value should be associated.
     * @param value The value to associate with the key.
     * @throws BackendException The backend failed to store the value.
     */
    void write(@NonNull String key, @NonNull String value) throws BackendException;

    /**
     * Returns the full value associated with the key.
     *
     * @param key The key of the record to be fetched.
     * @return The stored value.
     * @throws KeyNotFoundException The key does not exist, including after it was deleted.
     * @throws BackendException The backend failed to read the value.
     */
    @NonNull
    String read(@NonNull String key) throws BackendException;

    /**
     * Deletes the record associated with the key.
     *
     * @param key The key of the record to be deleted.
     * @throws KeyNotFoundException The key does not exist.
     * @throws BackendException The backend failed to delete the record.
     */
    void delete(@NonNull String key) throws BackendException;
}
