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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;
import java.time.Duration;
import java.util.List;

/**
 * @param payloadSize length of the random value written by every sequence
 * @param targetRates rates to test, in order, in operation sequences per second
 * @param campaignDuration dispatch window of each campaign, whole seconds
 */
public record TesterConfig(int payloadSize, List<Long> targetRates, Duration campaignDuration) {
    public static final int DEFAULT_PAYLOAD_SIZE = 1024;
    public static final List<Long> DEFAULT_TARGET_RATES =
            ImmutableList.of(10L, 20L, 50L, 100L, 200L, 500L, 1000L);
    public static final Duration DEFAULT_CAMPAIGN_DURATION = Duration.ofSeconds(30);
    /** One dispatch per nanosecond. */
    public static final long MAX_TARGET_RATE = 1_000_000_000L;

    public TesterConfig {
        requireNonNull(targetRates);
        requireNonNull(campaignDuration);
        checkArgument(payloadSize > 0, "payload size must be positive: %s", payloadSize);
        checkArgument(!targetRates.isEmpty(), "at least one target rate is required");
        checkArgument(
                campaignDuration.getSeconds() > 0 && campaignDuration.getNano() == 0,
                "campaign duration must be a positive number of seconds: %s",
                campaignDuration);
        for (Long rate : targetRates) {
            checkArgument(rate != null && rate > 0, "target rate must be positive: %s", rate);
            checkArgument(
                    rate <= MAX_TARGET_RATE, "target rate must not exceed %s: %s", MAX_TARGET_RATE, rate);
            checkArgument(
                    LongMath.saturatedMultiply(rate, campaignDuration.getSeconds())
                            <= Integer.MAX_VALUE,
                    "too many sequences in one campaign: %s/s for %ss",
                    rate,
                    campaignDuration.getSeconds());
        }
        targetRates = ImmutableList.copyOf(targetRates);
    }

    public static TesterConfig defaults() {
        return new TesterConfig(DEFAULT_PAYLOAD_SIZE, DEFAULT_TARGET_RATES, DEFAULT_CAMPAIGN_DURATION);
    }

    public long sequencesPerCampaign(long qps) {
        return Math.multiplyExact(qps, campaignDuration.getSeconds());
    }
}
