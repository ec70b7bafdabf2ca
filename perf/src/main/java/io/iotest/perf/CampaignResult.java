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

import io.iotest.perf.histogram.LatencyHistogram;
import java.time.Duration;

/**
 * Outcome of one campaign at a fixed target rate.
 *
 * @param qps target rate in operation sequences per second
 * @param plannedDuration length of the dispatch window
 * @param scheduled number of sequences dispatched
 * @param elapsed wall-clock time from the first dispatch until every sequence completed
 * @param missedDeadlines dispatches whose scheduled time had already passed
 */
public record CampaignResult(
        long qps,
        Duration plannedDuration,
        long scheduled,
        Duration elapsed,
        long missedDeadlines,
        LatencyHistogram writeLatency,
        LatencyHistogram readLatency,
        LatencyHistogram deleteLatency) {

    public double missedPercentage() {
        if (scheduled == 0) {
            return 0.0;
        }
        return missedDeadlines * 100.0 / scheduled;
    }

    public LatencyHistogram histogram(OperationKind kind) {
        return switch (kind) {
            case WRITE -> writeLatency;
            case READ -> readLatency;
            case DELETE -> deleteLatency;
        };
    }
}
