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
package io.iotest.perf.generator;

import java.util.concurrent.ThreadLocalRandom;

/** Produces the same random alphanumeric payload on every call. */
final class FixedLengthPayloadGenerator implements Generator<String> {
    private static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final String payload;

    FixedLengthPayloadGenerator(int size) {
        final ThreadLocalRandom random = ThreadLocalRandom.current();
        final char[] chars = new char[size];
        for (int i = 0; i < size; i++) {
            chars[i] = ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length()));
        }
        payload = new String(chars);
    }

    @Override
    public String nextValue() {
        return payload;
    }
}
