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

import org.HdrHistogram.Histogram;

/** Latency percentiles of one operation kind, in milliseconds. */
public record LatencyPercentiles(double p50, double p95, double p99, double p999, double max) {
    private static final double MICROS_PER_MILLI = 1000.0;

    static LatencyPercentiles of(Histogram micros) {
        return new LatencyPercentiles(
                millisAt(micros, 50),
                millisAt(micros, 95),
                millisAt(micros, 99),
                millisAt(micros, 99.9),
                micros.getMaxValue() / MICROS_PER_MILLI);
    }

    private static double millisAt(Histogram micros, double percentile) {
        return micros.getValueAtPercentile(percentile) / MICROS_PER_MILLI;
    }
}
