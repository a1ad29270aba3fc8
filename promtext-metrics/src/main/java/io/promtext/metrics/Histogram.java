// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics;

import static io.promtext.metrics.core.MetricsException.Reason.RESERVED_LABEL_NAME;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.promtext.metrics.core.Buckets;
import io.promtext.metrics.core.MetricCell;
import io.promtext.metrics.core.MetricDescriptor;
import io.promtext.metrics.core.MetricType;
import io.promtext.metrics.core.MetricUtils;
import io.promtext.metrics.core.MetricsException;
import io.promtext.metrics.core.SampleWriter;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * A metric of type {@link MetricType#HISTOGRAM}, registering a {@link Cell} per label value combination
 * that counts observations into cumulative buckets defined by {@link Buckets}.
 * <p>
 * Label name {@value #LE_LABEL} is reserved, because it is added to every bucket line.
 */
public final class Histogram extends MetricDescriptor<Histogram.Cell> {

    /** Label name holding the bucket bound on bucket lines. */
    public static final String LE_LABEL = "le";

    private static final String SUM_SUFFIX = "_sum";
    private static final String COUNT_SUFFIX = "_count";

    private final Buckets buckets;

    private Histogram(Builder builder) {
        super(builder);
        buckets = builder.buckets;
    }

    /**
     * Create a builder for a {@link Histogram} with the given metric name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    /**
     * @return the bucket bounds of this histogram, never {@code null}
     */
    @NonNull
    public Buckets buckets() {
        return buckets;
    }

    @NonNull
    @Override
    protected Cell createCell() {
        return new Cell(buckets.toArray());
    }

    /**
     * Builder for {@link Histogram}.
     * <p>
     * Default buckets are {@link Buckets#none()}, so only the {@code +Inf} bucket is written.
     */
    public static final class Builder extends MetricDescriptor.Builder<Builder, Histogram> {

        private Buckets buckets = Buckets.none();

        private Builder(@NonNull String name) {
            super(MetricType.HISTOGRAM, name);
        }

        /**
         * Sets the bucket bounds.
         *
         * @param buckets the bucket bounds, must not be {@code null}
         * @return this builder
         */
        @NonNull
        public Builder setBuckets(@NonNull Buckets buckets) {
            this.buckets = Objects.requireNonNull(buckets, "buckets must not be null");
            return this;
        }

        /**
         * Sets explicit bucket bounds. See {@link Buckets#of(long...)}.
         *
         * @param bounds the bucket bounds, must be strictly increasing and non-negative
         * @return this builder
         * @throws NullPointerException     if bounds is {@code null}
         * @throws IllegalArgumentException if any bound is negative
         * @throws MetricsException         with {@link MetricsException.Reason#UNORDERED_BUCKETS}
         *                                  if bounds are not strictly increasing
         */
        @NonNull
        public Builder setBuckets(@NonNull long... bounds) {
            return setBuckets(Buckets.of(bounds));
        }

        /**
         * Build the {@link Histogram} metric.
         *
         * @return the histogram
         * @throws MetricsException with {@link MetricsException.Reason#RESERVED_LABEL_NAME} if label name
         *                          {@value #LE_LABEL} is declared
         */
        @NonNull
        @Override
        protected Histogram buildDescriptor() {
            if (labelNames().contains(LE_LABEL)) {
                throw new MetricsException(
                        RESERVED_LABEL_NAME, "\"" + LE_LABEL + "\" is not allowed as label name in histogram");
            }
            return new Histogram(this);
        }
    }

    /**
     * A cell holding cumulative bucket counts, the sum and the count of all observations.
     * <p>
     * Bucket counts, sum and count are updated together under the monitor of this cell, so a written sample set
     * is always consistent. Different cells never contend. Sum and count wrap around on {@code long} overflow.
     */
    public static final class Cell extends MetricCell {

        private final long[] bounds;
        private final long[] counts;
        private long sum;
        private long count;

        private Cell(long[] bounds) {
            this.bounds = bounds;
            this.counts = new long[bounds.length];
        }

        /**
         * Records an observation: every bucket with a bound not less than the value is incremented.
         *
         * @param value the observed value
         */
        public synchronized void observe(long value) {
            sum += value;
            count++;
            for (int i = firstBucketNotLessThan(value); i < counts.length; i++) {
                counts[i]++;
            }
        }

        private int firstBucketNotLessThan(long value) {
            final int idx = Arrays.binarySearch(bounds, value);
            return idx >= 0 ? idx : -idx - 1;
        }

        synchronized long sum() {
            return sum;
        }

        synchronized long count() {
            return count;
        }

        synchronized long[] bucketCounts() {
            return counts.clone();
        }

        @Override
        protected synchronized void writeSamples(@NonNull SampleWriter writer) throws IOException {
            for (int i = 0; i < bounds.length; i++) {
                writer.writeBucket(bounds[i], counts[i]);
            }
            writer.writeInfBucket(count);
            writer.writeSample(SUM_SUFFIX, Long.toString(sum));
            writer.writeSample(COUNT_SUFFIX, Long.toString(count));
        }
    }
}
