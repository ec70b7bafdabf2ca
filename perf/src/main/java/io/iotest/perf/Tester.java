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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.iotest.client.api.StorageClient;
import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import io.iotest.perf.generator.Generator;
import io.iotest.perf.generator.Generators;
import io.iotest.perf.histogram.LatencyHistogram;
import io.iotest.perf.output.Output;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a storage backend with open-loop write-read-delete sequences at fixed target rates.
 *
 * <p>A single thread advances the schedule and generates keys. Each sequence runs on its own
 * thread from an unbounded pool, so a slow backend never delays the next dispatch.
 */
@Slf4j
public final class Tester implements Closeable {
    static final String SMOKE_TEST_VALUE = "Hello World";
    private static final int PROGRESS_STEPS = 10;

    private final StorageClient client;
    private final StorageClientHandler handler;
    private final TesterConfig config;
    private final Output output;
    private final Generator<String> payloadGenerator;
    private final ExecutorService executor;
    private final Ticker ticker;
    private final Sleeper sleeper;
    private final Lock keyLock = new ReentrantLock();

    public Tester(StorageClient client, TesterConfig config, Output output) {
        this(
                client,
                config,
                output,
                Executors.newCachedThreadPool(
                        new ThreadFactoryBuilder()
                                .setNameFormat("iotest-sequence-%d")
                                .setDaemon(true)
                                .build()),
                Ticker.systemTicker(),
                Sleeper.SYSTEM);
    }

    @VisibleForTesting
    Tester(
            StorageClient client,
            TesterConfig config,
            Output output,
            ExecutorService executor,
            Ticker ticker,
            Sleeper sleeper) {
        this.client = client;
        this.handler = client.handler();
        this.config = config;
        this.output = output;
        this.payloadGenerator = Generators.createFixedLengthPayloadGenerator(config.payloadSize());
        this.executor = executor;
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /** Initializes the backend, checks it for correctness, then runs every configured campaign. */
    public List<CampaignResult> test() throws BackendException, InterruptedException {
        log.info("init the storage client");
        client.init();

        smokeTest();

        final List<CampaignResult> results = new ArrayList<>(config.targetRates().size());
        for (long qps : config.targetRates()) {
            results.add(testQps(qps));
        }
        return results;
    }

    /** Runs one write-read-delete sequence with a fixed value. Timing is not measured. */
    public void smokeTest() throws BackendException {
        log.info("try write-read-delete ops");
        final String key = nextKey();
        handler.write(key, SMOKE_TEST_VALUE);
        final String value = handler.read(key);
        OperationSequence.verifyValue(key, SMOKE_TEST_VALUE, value);
        handler.delete(key);
        OperationSequence.verifyAbsent(handler, key);
        log.info("write-read-delete ops passed. key={}", key);
    }

    public CampaignResult testQps(long qps) throws BackendException, InterruptedException {
        checkArgument(qps > 0, "qps must be positive: %s", qps);
        final long total = config.sequencesPerCampaign(qps);
        checkArgument(total <= Integer.MAX_VALUE, "too many sequences in one campaign: %s", total);
        final long progressStep = Math.max(1, total / PROGRESS_STEPS);
        log.info(
                "campaign is starting. qps={} duration={}s sequences={}",
                qps,
                config.campaignDuration().getSeconds(),
                total);

        final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        final Pacer pacer = new Pacer(qps, ticker, sleeper);
        final List<Future<SequenceResult>> inflight = new ArrayList<>((int) total);
        for (long i = 0; i < total; i++) {
            pacer.awaitNextTick();
            final String key = nextKey();
            inflight.add(executor.submit(new OperationSequence(handler, key, payloadGenerator.nextValue())));
            if ((i + 1) % progressStep == 0) {
                log.info(
                        "dispatched {}/{} sequences. missed deadlines {}",
                        i + 1,
                        total,
                        pacer.getMissedDeadlines());
            }
        }

        final LatencyHistogram writeLatency = new LatencyHistogram();
        final LatencyHistogram readLatency = new LatencyHistogram();
        final LatencyHistogram deleteLatency = new LatencyHistogram();
        for (Future<SequenceResult> future : inflight) {
            final SequenceResult result = join(future);
            writeLatency.record(result.writeMicros());
            readLatency.record(result.readMicros());
            deleteLatency.record(result.deleteMicros());
        }

        final CampaignResult result =
                new CampaignResult(
                        qps,
                        config.campaignDuration(),
                        total,
                        stopwatch.elapsed(),
                        pacer.getMissedDeadlines(),
                        writeLatency,
                        readLatency,
                        deleteLatency);
        log.info(
                "campaign is done. qps={} elapsed={}ms missed deadlines={}",
                qps,
                result.elapsed().toMillis(),
                result.missedDeadlines());
        output.report(result);
        return result;
    }

    @VisibleForTesting
    String nextKey() {
        keyLock.lock();
        try {
            return client.genUniqueKey();
        } finally {
            keyLock.unlock();
        }
    }

    private static SequenceResult join(Future<SequenceResult> future)
            throws BackendException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            final Throwable cause = ex.getCause();
            if (cause instanceof BackendException) {
                throw (BackendException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TesterException(cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
