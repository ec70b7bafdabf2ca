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

import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import java.util.concurrent.TimeUnit;
import lombok.Getter;

/**
 * Open-loop dispatch schedule. Tick {@code i} is due at {@code start + i / qps} seconds. Due times
 * are derived from the start, never from the moment the previous tick actually fired, so a late
 * tick neither shifts nor resynchronizes the rest of the schedule.
 */
final class Pacer {
    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final long qps;
    private final Ticker ticker;
    private final Sleeper sleeper;
    @Getter private final long startNanos;
    @Getter private long ticks;
    @Getter private long missedDeadlines;

    Pacer(long qps, Ticker ticker, Sleeper sleeper) {
        checkArgument(qps > 0 && qps <= NANOS_PER_SECOND, "qps out of range: %s", qps);
        this.qps = qps;
        this.ticker = ticker;
        this.sleeper = sleeper;
        this.startNanos = ticker.read();
    }

    long scheduledNanos(long tick) {
        return startNanos + LongMath.checkedMultiply(tick, NANOS_PER_SECOND) / qps;
    }

    /**
     * Waits until the next tick is due. Returns immediately when the due time has already passed
     * and counts it as a missed deadline. The first tick opens the schedule and is never missed.
     *
     * @return {@code true} if the tick was on time
     */
    boolean awaitNextTick() throws InterruptedException {
        final long tick = ticks++;
        final long scheduled = scheduledNanos(tick);
        final long now = ticker.read();
        if (now < scheduled) {
            sleeper.sleep(scheduled - now);
            return true;
        }
        if (tick == 0) {
            return true;
        }
        missedDeadlines++;
        return false;
    }
}
