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
package io.iotest.perf.histogram;

import java.util.Locale;

/**
 * Fixed latency bucket edges in microseconds: {@code 32 * sqrt(2)^k} for {@code k = 0..23}, which
 * covers 32µs up to about 92.7ms. Samples above the last edge fall in the overflow bucket.
 */
public final class LatencyBuckets {
    public static final int EDGE_COUNT = 24;
    public static final int OVERFLOW_INDEX = EDGE_COUNT;

    private static final double BASE_MICROS = 32.0;
    private static final double[] EDGES = computeEdges();

    private LatencyBuckets() {}

    private static double[] computeEdges() {
        final double[] edges = new double[EDGE_COUNT];
        final double sqrt2 = Math.sqrt(2);
        for (int k = 0; k < EDGE_COUNT; k++) {
            // even steps are exact powers of two
            final double power = BASE_MICROS * (1L << (k / 2));
            edges[k] = (k % 2 == 0) ? power : power * sqrt2;
        }
        return edges;
    }

    public static double edge(int index) {
        return EDGES[index];
    }

    /** Index of the first edge greater than or equal to the sample, or {@link #OVERFLOW_INDEX}. */
    public static int indexOf(long micros) {
        for (int i = 0; i < EDGE_COUNT; i++) {
            if (micros <= EDGES[i]) {
                return i;
            }
        }
        return OVERFLOW_INDEX;
    }

    /** Human readable edge label: microseconds below 1000µs, milliseconds above. */
    public static String bucketName(int index) {
        if (index >= EDGE_COUNT) {
            return "+inf";
        }
        final double micros = EDGES[index];
        if (micros < 1000.0) {
            return String.format(Locale.ROOT, "%.2fµs", micros);
        }
        return String.format(Locale.ROOT, "%.2fms", micros / 1000.0);
    }
}
