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

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.base.Ticker;
import io.iotest.client.api.StorageClientHandler;
import io.iotest.client.api.exceptions.BackendException;
import io.iotest.client.api.exceptions.KeyNotFoundException;
import io.iotest.client.memory.InMemoryStorageClient;
import io.iotest.perf.output.Output;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TesterTest {

    private static final long MS = MILLISECONDS.toNanos(1);

    @Mock Output output;

    FakeClock clock;
    ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new FakeClock();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static TesterConfig config(long... rates) {
        List<Long> list = new ArrayList<>();
        for (long rate : rates) {
            list.add(rate);
        }
        return new TesterConfig(64, list, Duration.ofSeconds(1));
    }

    private Tester tester(RecordingStorageClient client, TesterConfig config) {
        return new Tester(client, config, output, executor, clock, clock);
    }

    @Nested
    class SmokeTest {
        @Mock StorageClientHandler handler;

        @Test
        void passesOnConsistentBackend() throws Exception {
            var client = new RecordingStorageClient(clock);
            tester(client, config(10)).smokeTest();
            assertThat(client.keyTimes()).hasSize(1);
        }

        @Test
        void failsOnValueMismatch() throws Exception {
            when(handler.read(anyString())).thenReturn("Hello Wordl");
            var client = new RecordingStorageClient(clock).withHandler(handler);

            assertThatThrownBy(() -> tester(client, config(10)).smokeTest())
                    .isInstanceOf(CorrectnessViolationException.class)
                    .hasMessageContaining("value mismatch");
            verify(handler).write(anyString(), eq(Tester.SMOKE_TEST_VALUE));
            verify(handler, never()).delete(anyString());
        }

        @Test
        void failsWhenKeySurvivesDelete() throws Exception {
            when(handler.read(anyString())).thenReturn(Tester.SMOKE_TEST_VALUE);
            var client = new RecordingStorageClient(clock).withHandler(handler);

            assertThatThrownBy(() -> tester(client, config(10)).smokeTest())
                    .isInstanceOf(CorrectnessViolationException.class)
                    .hasMessageContaining("succeeded after delete");
            verify(handler).delete(anyString());
            verify(handler, times(2)).read(anyString());
        }

        @Test
        void propagatesBackendError() throws Exception {
            doThrow(new BackendException("write", "k", "read-only filesystem"))
                    .when(handler)
                    .write(anyString(), anyString());
            var client = new RecordingStorageClient(clock).withHandler(handler);

            assertThatThrownBy(() -> tester(client, config(10)).test())
                    .isInstanceOf(BackendException.class)
                    .hasMessage("write k: read-only filesystem");
            assertThat(client.inits()).isEqualTo(1);
            verify(output, never()).report(any());
        }
    }

    @Test
    void dispatchesOnScheduleAndRecordsEverySequence() throws Exception {
        var client = new RecordingStorageClient(clock);

        CampaignResult result = tester(client, config(10)).testQps(10);

        assertThat(client.keyTimes())
                .containsExactly(0L, 100 * MS, 200 * MS, 300 * MS, 400 * MS, 500 * MS, 600 * MS,
                        700 * MS, 800 * MS, 900 * MS);
        assertThat(result.qps()).isEqualTo(10);
        assertThat(result.scheduled()).isEqualTo(10);
        assertThat(result.missedDeadlines()).isZero();
        assertThat(result.missedPercentage()).isZero();
        assertThat(result.writeLatency().totalCount()).isEqualTo(10);
        assertThat(result.readLatency().totalCount()).isEqualTo(10);
        assertThat(result.deleteLatency().totalCount()).isEqualTo(10);
        assertThat(result.elapsed()).isEqualTo(Duration.ofMillis(900));
        verify(output).report(result);
    }

    @Test
    void stalledDispatchCountsOneMissedDeadline() throws Exception {
        // generating the third key stalls the dispatcher past the fourth due time
        var client =
                new RecordingStorageClient(clock)
                        .onKey(index -> {
                            if (index == 2) {
                                clock.advance(Duration.ofMillis(150));
                            }
                        });

        CampaignResult result = tester(client, config(10)).testQps(10);

        assertThat(result.missedDeadlines()).isEqualTo(1);
        assertThat(result.missedPercentage()).isEqualTo(10.0);
        assertThat(client.keyTimes().subList(0, 5))
                .containsExactly(0L, 100 * MS, 200 * MS, 350 * MS, 400 * MS);
        assertThat(result.writeLatency().totalCount()).isEqualTo(10);
    }

    @Test
    void runsEveryCampaignInOrderAfterSmokeTest() throws Exception {
        var client = new RecordingStorageClient(clock);

        List<CampaignResult> results = tester(client, config(5, 20)).test();

        assertThat(client.inits()).isEqualTo(1);
        assertThat(results).extracting(CampaignResult::qps).containsExactly(5L, 20L);
        assertThat(results).extracting(CampaignResult::scheduled).containsExactly(5L, 20L);
        // smoke test key plus one per scheduled sequence
        assertThat(client.keyTimes()).hasSize(1 + 5 + 20);

        ArgumentCaptor<CampaignResult> reported = ArgumentCaptor.forClass(CampaignResult.class);
        verify(output, times(2)).report(reported.capture());
        assertThat(reported.getAllValues()).containsExactlyElementsOf(results);
    }

    @Test
    void failingSequenceFailsTheCampaign() throws Exception {
        var client = new RecordingStorageClient(clock);
        StorageClientHandler delegate = client.delegateHandler();
        client.withHandler(
                new StorageClientHandler() {
                    @Override
                    public void write(String key, String value) throws BackendException {
                        delegate.write(key, value);
                    }

                    @Override
                    public String read(String key) throws BackendException {
                        String value = delegate.read(key);
                        return key.equals("mem-3") ? value + "!" : value;
                    }

                    @Override
                    public void delete(String key) throws BackendException {
                        delegate.delete(key);
                    }
                });

        assertThatThrownBy(() -> tester(client, config(10)).testQps(10))
                .isInstanceOf(CorrectnessViolationException.class)
                .hasMessageStartingWith("read mem-3: value mismatch");
        verify(output, never()).report(any());
    }

    @Test
    void backendErrorInSequenceIsRethrownUnwrapped() throws Exception {
        var client = new RecordingStorageClient(clock);
        StorageClientHandler delegate = client.delegateHandler();
        client.withHandler(
                new StorageClientHandler() {
                    @Override
                    public void write(String key, String value) throws BackendException {
                        delegate.write(key, value);
                    }

                    @Override
                    public String read(String key) throws BackendException {
                        return delegate.read(key);
                    }

                    @Override
                    public void delete(String key) throws BackendException {
                        if (key.equals("mem-7")) {
                            throw new KeyNotFoundException("delete", key);
                        }
                        delegate.delete(key);
                    }
                });

        assertThatThrownBy(() -> tester(client, config(10)).testQps(10))
                .isInstanceOf(KeyNotFoundException.class)
                .hasMessage("delete mem-7: not found");
    }

    @Test
    void dispatchDoesNotWaitForCompletion() throws Exception {
        var release = new CountDownLatch(1);
        var started = new AtomicInteger();
        var client = new RecordingStorageClient(clock);
        StorageClientHandler delegate = client.delegateHandler();
        client.withHandler(
                new StorageClientHandler() {
                    @Override
                    public void write(String key, String value) throws BackendException {
                        started.incrementAndGet();
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new BackendException("write", key, e);
                        }
                        delegate.write(key, value);
                    }

                    @Override
                    public String read(String key) throws BackendException {
                        return delegate.read(key);
                    }

                    @Override
                    public void delete(String key) throws BackendException {
                        delegate.delete(key);
                    }
                });
        var tester = tester(client, config(20));

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<CampaignResult> campaign = runner.submit(() -> tester.testQps(20));

            // every sequence is in flight while none has completed
            await().atMost(Duration.ofSeconds(10)).until(() -> started.get() == 20);
            assertThat(client.keyTimes()).hasSize(20);
            assertThat(campaign.isDone()).isFalse();

            release.countDown();
            CampaignResult result = campaign.get();
            assertThat(result.writeLatency().totalCount()).isEqualTo(20);
            assertThat(result.missedDeadlines()).isZero();
        } finally {
            release.countDown();
            runner.shutdownNow();
        }
    }

    @Test
    void keyGenerationIsSerialized() throws Exception {
        var tester =
                new Tester(new InMemoryStorageClient(), config(10), output, executor, clock, clock);
        int threads = 8;
        int perThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(
                        pool.submit(
                                () -> {
                                    List<String> keys = new ArrayList<>(perThread);
                                    for (int i = 0; i < perThread; i++) {
                                        keys.add(tester.nextKey());
                                    }
                                    return keys;
                                }));
            }
            Set<String> all = new HashSet<>();
            for (Future<List<String>> future : futures) {
                all.addAll(future.get());
            }
            assertThat(all).hasSize(threads * perThread);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void realClockCampaign() throws Exception {
        var client = new RecordingStorageClient(Ticker.systemTicker());
        try (var tester = new Tester(client, config(10), output)) {
            CampaignResult result = tester.testQps(10);

            assertThat(result.scheduled()).isEqualTo(10);
            assertThat(result.writeLatency().totalCount()).isEqualTo(10);
            assertThat(result.elapsed()).isGreaterThanOrEqualTo(Duration.ofMillis(900));
            List<Long> times = client.keyTimes();
            for (int i = 1; i < times.size(); i++) {
                assertThat(times.get(i)).isGreaterThanOrEqualTo(times.get(i - 1));
            }
            assertThat(times.get(9) - times.get(0)).isGreaterThanOrEqualTo(850 * MS);
        }
    }
}
