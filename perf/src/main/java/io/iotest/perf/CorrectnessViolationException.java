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

import com.google.common.base.Ascii;
import lombok.Getter;

/** The backend did not behave like a consistent key-value store. Always fatal. */
@Getter
public final class CorrectnessViolationException extends TesterException {
    private static final int MAX_VALUE_LENGTH = 32;

    private final String key;

    private CorrectnessViolationException(String key, String message) {
        super(message);
        this.key = key;
    }

    public static CorrectnessViolationException valueMismatch(
            String key, String expected, String actual) {
        return new CorrectnessViolationException(
                key,
                "read "
                        + key
                        + ": value mismatch. expect: "
                        + abbreviate(expected)
                        + ", actual: "
                        + abbreviate(actual));
    }

    public static CorrectnessViolationException presentAfterDelete(String key) {
        return new CorrectnessViolationException(
                key, "read " + key + ": succeeded after delete, expected an error");
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "null";
        }
        return "\"" + Ascii.truncate(value, MAX_VALUE_LENGTH, "...") + "\" (" + value.length() + " chars)";
    }
}
