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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.math.LongMath;
import io.iotest.perf.CampaignResult;
import io.iotest.perf.OperationKind;
import io.iotest.perf.histogram.LatencyPercentiles;
import io.iotest.perf.histogram.LatencyBuckets;
import io.iotest.perf.histogram.LatencyHistogram;
import java.io.IOException;
import java.io.PrintStream;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/** Human readable campaign report with a text sparkline per operation. */
@Slf4j
final class ConsoleOutput implements Output {
    static final int BAR_WIDTH = 100;
    private static final String RULE = "-".repeat(10 + 1 + BAR_WIDTH + 1 + 10);

    private final PrintStream out;
    private final ChartRenderer chartRenderer;

    /**
     * @param out where the report is printed
     * @param chartRenderer renders the chart of each histogram, {@code null} to skip charts
     */
    ConsoleOutput(PrintStream out, ChartRenderer chartRenderer) {
        this.out = out;
        this.chartRenderer = chartRenderer;
    }

    @Override
    public void report(CampaignResult result) {
        final StringBuilder sb = new StringBuilder();
        sb.append("TEST:\n");
        sb.append(String.format(Locale.ROOT, "  QPS:           %d\n", result.qps()));
        sb.append(
                String.format(
                        Locale.ROOT, "  TEST TIME (s): %d\n", result.plannedDuration().getSeconds()));
        sb.append(
                String.format(
                        Locale.ROOT, "  DURATION TIME: %.3fs\n", result.elapsed().toNanos() / 1e9));
        sb.append(
                String.format(
                        Locale.ROOT,
                        "  MISSED SLEEP:  %d (%.2f%%)\n",
                        result.missedDeadlines(),
                        result.missedPercentage()));
        for (OperationKind kind : OperationKind.values()) {
            final LatencyHistogram histogram = result.histogram(kind);
            sb.append("  ").append(kind.name()).append(" HISTOGRAM:\n");
            sb.append("    ").append(RULE).append('\n');
            sb.append(renderHistogram(histogram));
            sb.append("    ").append(RULE).append('\n');
            sb.append("    ").append(renderPercentiles(histogram.percentiles())).append('\n');
            final Path chart = renderChart(ChartRenderer.chartName(kind, result.qps()), histogram);
            if (chart != null) {
                sb.append("    See also: ").append(chart).append('\n');
            }
            sb.append("    ").append(RULE).append('\n');
        }
        out.print(sb);
        out.flush();
    }

    /**
     * One line per second edge. Each line covers the samples between the previous shown edge and
     * its own; the final {@code +inf} line covers everything above the last shown edge.
     */
    @VisibleForTesting
    static String renderHistogram(LatencyHistogram histogram) {
        final long total = histogram.totalCount();
        if (total == 0) {
            return "    (no samples)\n";
        }
        final StringBuilder sb = new StringBuilder();
        long before = 0;
        for (int i = 0; i < LatencyBuckets.EDGE_COUNT; i += 2) {
            final long cumulative = histogram.cumulativeCount(i);
            appendBar(sb, LatencyBuckets.bucketName(i), cumulative - before, total);
            before = cumulative;
        }
        appendBar(sb, LatencyBuckets.bucketName(LatencyBuckets.OVERFLOW_INDEX), total - before, total);
        return sb.toString();
    }

    private static void appendBar(StringBuilder sb, String label, long delta, long total) {
        final int dots = (int) LongMath.divide(delta * BAR_WIDTH, total, RoundingMode.CEILING);
        sb.append(
                String.format(
                        Locale.ROOT,
                        "    %-10s %s%s %d\n",
                        label,
                        Strings.repeat(".", dots),
                        Strings.repeat(" ", BAR_WIDTH - dots),
                        delta));
    }

    private static String renderPercentiles(LatencyPercentiles percentiles) {
        return String.format(
                Locale.ROOT,
                "Latency ms: 50%% %.3f - 95%% %.3f - 99%% %.3f - 99.9%% %.3f - max %.3f",
                percentiles.p50(),
                percentiles.p95(),
                percentiles.p99(),
                percentiles.p999(),
                percentiles.max());
    }

    private Path renderChart(String name, LatencyHistogram histogram) {
        if (chartRenderer == null || histogram.totalCount() == 0) {
            return null;
        }
        try {
            return chartRenderer.render(name, histogram);
        } catch (IOException ex) {
            log.warn("failed to render chart {}. {}", name, ex.getMessage());
            return null;
        }
    }

    @Override
    public void close() {
        out.flush();
    }
}
