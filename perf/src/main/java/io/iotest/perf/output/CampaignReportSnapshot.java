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
package io.iotest.perf.output;

import com.google.common.math.DoubleMath;
import io.iotest.perf.CampaignResult;
import io.iotest.perf.OperationKind;
import io.iotest.perf.histogram.LatencyBuckets;
import io.iotest.perf.histogram.LatencyHistogram;
import io.iotest.perf.histogram.LatencyPercentiles;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

public record CampaignReportSnapshot(
        /* metadata section */
        long timestamp,
        long qps,
        long testTimeSec,
        long scheduled,
        double durationMs,
        long missedDeadlines,
        double missedPercentage,
        /* latency section */
        OperationReport write,
        OperationReport read,
        OperationReport delete) {

    /**
     * @param latencyMs percentiles in milliseconds
     * @param buckets sample count per bucket, keyed by edge name; {@code +inf} is the overflow
     */
    public record OperationReport(long total, LatencyPercentiles latencyMs, Map<String, Long> buckets) {

        static OperationReport fromHistogram(LatencyHistogram histogram) {
            final Map<String, Long> buckets = new LinkedHashMap<>();
            for (int i = 0; i <= LatencyBuckets.OVERFLOW_INDEX; i++) {
                buckets.put(LatencyBuckets.bucketName(i), histogram.bucketCount(i));
            }
            return new OperationReport(histogram.totalCount(), histogram.percentiles(), buckets);
        }
    }

    public static CampaignReportSnapshot fromResult(CampaignResult result, long timestamp) {
        return new CampaignReportSnapshot(
                timestamp,
                result.qps(),
                result.plannedDuration().getSeconds(),
                result.scheduled(),
                roundUp2(result.elapsed().toNanos() / 1e6),
                result.missedDeadlines(),
                roundUp2(result.missedPercentage()),
                OperationReport.fromHistogram(result.histogram(OperationKind.WRITE)),
                OperationReport.fromHistogram(result.histogram(OperationKind.READ)),
                OperationReport.fromHistogram(result.histogram(OperationKind.DELETE)));
    }

    /** Rounds towards positive infinity at two decimal places. */
    private static double roundUp2(double value) {
        return DoubleMath.roundToLong(value * 100, RoundingMode.CEILING) / 100.0;
    }
}
