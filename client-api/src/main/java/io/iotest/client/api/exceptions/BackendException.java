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
package io.iotest.client.api.exceptions;

import lombok.Getter;
import lombok.NonNull;

/** An operation against the backend failed. */
@Getter
public class BackendException extends IoTestException {
    private final String operation;
    private final String key;

    public BackendException(@NonNull String operation, @NonNull String key, @NonNull Throwable cause) {
        super(operation + " " + key + ": " + describe(cause), cause);
        this.operation = operation;
        this.key = key;
    }

    public BackendException(@NonNull String operation, @NonNull String key, @NonNull String reason) {
        super(operation + " " + key + ": " + reason);
        this.operation = operation;
        this.key = key;
    }

    private static String describe(Throwable cause) {
        final String message = cause.getMessage();
        if (message == null || message.isEmpty()) {
            return cause.getClass().getSimpleName();
        }
        return cause.getClass().getSimpleName() + " " + message;
    }
}
