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
package io.iotest.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.iotest.client.api.StorageClient;
import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.KeyNotFoundException;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behaviour every {@link StorageClient} must share. */
public abstract class StorageClientTestBase {

    protected StorageClient client;
    protected StorageClientHandler handler;

    protected abstract StorageClient newClient() throws Exception;

    @BeforeEach
    void setUp() throws Exception {
        client = newClient();
        client.init();
        handler = client.handler();
    }

    @Test
    void keysAreUnique() {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            keys.add(client.genUniqueKey());
        }
        assertThat(keys).hasSize(10_000);
    }

    @Test
    void initIsIdempotent() throws Exception {
        client.init();
        client.init();
        String key = client.genUniqueKey();
        handler.write(key, "v");
        assertThat(handler.read(key)).isEqualTo("v");
    }

    @Test
    void writeThenRead() throws Exception {
        String key = client.genUniqueKey();
        handler.write(key, "Hello World");
        assertThat(handler.read(key)).isEqualTo("Hello World");
    }

    @Test
    void writeOverwrites() throws Exception {
        String key = client.genUniqueKey();
        handler.write(key, "a much longer first value");
        handler.write(key, "short");
        assertThat(handler.read(key)).isEqualTo("short");
    }

    @Test
    void readAfterDeleteFails() throws Exception {
        String key = client.genUniqueKey();
        handler.write(key, "value");
        handler.delete(key);
        assertThatThrownBy(() -> handler.read(key))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageStartingWith("read " + key);
    }

    @Test
    void deleteMissingKeyFails() {
        String key = client.genUniqueKey();
        assertThatThrownBy(() -> handler.delete(key))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessageStartingWith("delete " + key);
    }

    @Test
    void handlerIsReentrant() throws Exception {
        StorageClientHandler other = client.handler();
        String key = client.genUniqueKey();
        handler.write(key, "shared");
        assertThat(other.read(key)).isEqualTo("shared");
        other.delete(key);
        assertThatThrownBy(() -> handler.read(key)).isInstanceOf(KeyNotFoundException.class);
    }
}
