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

import static java.util.Objects.requireNonNull;

import io.iotest.client.api.StorageClient;
import io.iotest.client.localfs.LocalFsStorageClient;
import io.iotest.client.memory.InMemoryStorageClient;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UtilityClass
public class StorageClients {

    public static StorageClient create(ClientType type, ClientOptions options) {
        requireNonNull(type);
        requireNonNull(options);
        if (type == ClientType.LOCALFS) {
            log.info("creating storage client. type={} prefix={}", type, options.localFsPrefix());
        } else {
            log.info("creating storage client. type={}", type);
        }
        return switch (type) {
            case LOCALFS -> new LocalFsStorageClient(options.localFsPrefix());
            case MEMORY -> new InMemoryStorageClient();
        };
    }
}
