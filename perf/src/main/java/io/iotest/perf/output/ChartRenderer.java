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
import com.google.common.math.LongMath;
import io.iotest.perf.OperationKind;
import io.iotest.perf.histogram.LatencyBuckets;
import io.iotest.perf.histogram.LatencyHistogram;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import javax.imageio.ImageIO;
import lombok.Getter;

/**
 * Renders a latency histogram as a PNG bar chart: one bar per bucket edge, scaled so the tallest
 * bar reaches 80% of the plot height.
 */
public final class ChartRenderer {
    static final int WIDTH = (128 + 64) * 10;
    static final int HEIGHT = 960;
    static final long FULL_SCALE = 10_000;
    static final long TALLEST_BAR = 8_000;

    private static final int MARGIN = 64;
    private static final int CAPTION_AREA = 64;
    private static final int X_LABEL_AREA = 128;
    private static final int Y_LABEL_AREA = 64 + 32;
    private static final int Y_TICKS = 10;
    private static final Color BAR_COLOR = new Color(255, 0, 0, 128);
    private static final Color MESH_COLOR = new Color(230, 230, 230);

    @Getter private final Path imagesDir;

    public ChartRenderer(Path imagesDir) {
        this.imagesDir = imagesDir;
    }

    public static String chartName(OperationKind kind, long qps) {
        return kind.label() + "-qps-" + qps;
    }

    /**
     * Bar heights in {@link #FULL_SCALE} units. Each bucket's share of the total is rounded up to
     * 1/10000 and rescaled so the largest share maps to {@link #TALLEST_BAR}.
     */
    @VisibleForTesting
    static long[] barHeights(LatencyHistogram histogram) {
        final long[] heights = new long[LatencyBuckets.EDGE_COUNT];
        final long maxShare = maxShare(histogram);
        if (maxShare == 0) {
            return heights;
        }
        for (int i = 0; i < heights.length; i++) {
            heights[i] = share(histogram, i) * TALLEST_BAR / maxShare;
        }
        return heights;
    }

    /** Bucket's share of all samples in 1/{@link #FULL_SCALE} units, rounded up. */
    private static long share(LatencyHistogram histogram, int index) {
        final long total = histogram.totalCount();
        if (total == 0) {
            return 0;
        }
        return LongMath.divide(histogram.bucketCount(index) * FULL_SCALE, total, RoundingMode.CEILING);
    }

    private static long maxShare(LatencyHistogram histogram) {
        long max = 0;
        for (int i = 0; i < LatencyBuckets.EDGE_COUNT; i++) {
            max = Math.max(max, share(histogram, i));
        }
        return max;
    }

    /** Share of all samples, in percent, that a bar of the given height stands for. */
    @VisibleForTesting
    static double percentAt(long height, long maxShare) {
        return height * (double) maxShare / TALLEST_BAR / 100.0;
    }

    public Path render(String name, LatencyHistogram histogram) throws IOException {
        Files.createDirectories(imagesDir);
        final Path file = imagesDir.resolve(name + ".png");

        final long maxShare = maxShare(histogram);
        final long[] heights = barHeights(histogram);

        final BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(
                    RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, WIDTH, HEIGHT);

            final int left = MARGIN + Y_LABEL_AREA;
            final int top = MARGIN + CAPTION_AREA;
            final int plotWidth = WIDTH - MARGIN - left;
            final int plotHeight = HEIGHT - MARGIN - X_LABEL_AREA - top;

            drawCaption(g, name);
            drawYAxis(g, left, top, plotHeight, maxShare, plotWidth);
            drawBars(g, heights, left, top, plotWidth, plotHeight);
            drawXAxis(g, left, top, plotWidth, plotHeight);
        } finally {
            g.dispose();
        }

        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("no png writer available for " + file);
        }
        return file;
    }

    private static void drawCaption(Graphics2D g, String name) {
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 48));
        final FontMetrics fm = g.getFontMetrics();
        g.setColor(Color.BLACK);
        g.drawString(name, (WIDTH - fm.stringWidth(name)) / 2, MARGIN + fm.getAscent());
    }

    private static void drawYAxis(
            Graphics2D g, int left, int top, int plotHeight, long maxShare, int plotWidth) {
        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 24));
        final FontMetrics fm = g.getFontMetrics();
        for (int t = 0; t <= Y_TICKS; t++) {
            final long value = FULL_SCALE * t / Y_TICKS;
            final int y = top + plotHeight - (int) (value * plotHeight / FULL_SCALE);
            g.setColor(MESH_COLOR);
            g.drawLine(left, y, left + plotWidth, y);
            final String label = String.format(Locale.ROOT, "%.2f%%", percentAt(value, maxShare));
            g.setColor(Color.BLACK);
            g.drawString(label, left - 8 - fm.stringWidth(label), y + fm.getAscent() / 2);
        }

        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 32));
        final AffineTransform saved = g.getTransform();
        g.rotate(-Math.PI / 2);
        g.drawString("percent", -(top + plotHeight / 2), MARGIN / 2);
        g.setTransform(saved);
    }

    private static void drawBars(
            Graphics2D g, long[] heights, int left, int top, int plotWidth, int plotHeight) {
        final double segment = (double) plotWidth / heights.length;
        g.setColor(BAR_COLOR);
        for (int i = 0; i < heights.length; i++) {
            final int barHeight = (int) (heights[i] * plotHeight / FULL_SCALE);
            final int x = left + (int) Math.round(i * segment);
            g.fillRect(x + 1, top + plotHeight - barHeight, (int) segment - 2, barHeight);
        }
    }

    private static void drawXAxis(Graphics2D g, int left, int top, int plotWidth, int plotHeight) {
        final int baseline = top + plotHeight;
        g.setColor(Color.BLACK);
        g.setStroke(new BasicStroke(2));
        g.drawLine(left, top, left, baseline);
        g.drawLine(left, baseline, left + plotWidth, baseline);

        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 24));
        final FontMetrics fm = g.getFontMetrics();
        final double segment = (double) plotWidth / LatencyBuckets.EDGE_COUNT;
        for (int i = 0; i < LatencyBuckets.EDGE_COUNT; i++) {
            final int center = left + (int) Math.round((i + 0.5) * segment);
            final AffineTransform saved = g.getTransform();
            g.translate(center + fm.getAscent() / 2, baseline + 8);
            g.rotate(Math.PI / 2);
            g.drawString(LatencyBuckets.bucketName(i), 0, 0);
            g.setTransform(saved);
        }

        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 32));
        final FontMetrics axis = g.getFontMetrics();
        g.drawString(
                "bucket",
                left + (plotWidth - axis.stringWidth("bucket")) / 2,
                HEIGHT - MARGIN / 2);
    }
}
