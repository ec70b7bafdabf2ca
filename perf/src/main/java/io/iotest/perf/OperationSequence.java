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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;

/** write, read and verify, delete, then verify the key is gone. */
@RequiredArgsConstructor
final class OperationSequence implements Callable<SequenceResult> {
    private final StorageClientHandler handler;
    private final String key;
    private final String payload;

    @Override
    public SequenceResult call() throws BackendException {
        long start = System.nanoTime();
        handler.write(key, payload);
        final long writeMicros = NANOSECONDS.toMicros(System.nanoTime() - start);

        start = System.nanoTime();
        final String value = handler.read(key);
        final long readMicros = NANOSECONDS.toMicros(System.nanoTime() - start);
        verifyValue(key, payload, value);

        start = System.nanoTime();
        handler.delete(key);
        final long deleteMicros = NANOSECONDS.toMicros(System.nanoTime() - start);

        verifyAbsent(handler, key);
        return new SequenceResult(writeMicros, readMicros, deleteMicros);
    }

    static void verifyValue(String key, String expected, String actual) {
        if (!expected.equals(actual)) {
            throw CorrectnessViolationException.valueMismatch(key, expected, actual);
        }
    }

    static void verifyAbsent(StorageClientHandler handler, String key) {
        try {
            handler.read(key);
        } catch (BackendException expected) {
            return;
        }
        throw CorrectnessViolationException.presentAfterDelete(key);
    }
}
