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

import java.io.File;
import java.nio.file.Path;

/**
 * Backend construction options.
 *
 * @param localFsPrefix directory under which the local filesystem backend stores its files
 */
public record ClientOptions(Path localFsPrefix) {

    public static ClientOptions defaults() {
        return new ClientOptions(defaultLocalFsPrefix());
    }

    public static Path defaultLocalFsPrefix() {
        return Path.of(
                System.getProperty("java.io.tmpdir", File.separator + "tmp"),
                "iotest_" + ProcessHandle.current().pid());
    }
}
