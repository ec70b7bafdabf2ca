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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import org.HdrHistogram.Histogram;

/**
 * Latency distribution over the {@link LatencyBuckets} edges plus an exact percentile tracker.
 *
 * <p>Not thread-safe. Samples are recorded from a single thread once a campaign has been joined.
 */
public final class LatencyHistogram {
    private final long[] counts = new long[LatencyBuckets.EDGE_COUNT + 1];
    private final Histogram exact = new Histogram(3);
    private long total;

    public void record(long micros) {
        checkArgument(micros >= 0, "latency can not be negative: %s", micros);
        counts[LatencyBuckets.indexOf(micros)]++;
        exact.recordValue(micros);
        total++;
    }

    /**
     * Samples that fell in the bucket ending at {@code index}. {@link LatencyBuckets#OVERFLOW_INDEX}
     * addresses the overflow bucket.
     */
    public long bucketCount(int index) {
        checkElementIndex(index, counts.length);
        return counts[index];
    }

    /** Samples less than or equal to the edge at {@code index}. */
    public long cumulativeCount(int index) {
        checkElementIndex(index, LatencyBuckets.EDGE_COUNT);
        long sum = 0;
        for (int i = 0; i <= index; i++) {
            sum += counts[i];
        }
        return sum;
    }

    public long overflowCount() {
        return counts[LatencyBuckets.OVERFLOW_INDEX];
    }

    public long totalCount() {
        return total;
    }

    public LatencyPercentiles percentiles() {
        return LatencyPercentiles.of(exact);
    }
}
