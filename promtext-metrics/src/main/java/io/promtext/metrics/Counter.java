// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.promtext.metrics.core.MetricCell;
import io.promtext.metrics.core.MetricDescriptor;
import io.promtext.metrics.core.MetricType;
import io.promtext.metrics.core.MetricUtils;
import io.promtext.metrics.core.SampleWriter;
import java.io.IOException;
import java.util.concurrent.atomic.LongAdder;

/**
 * A metric of type {@link MetricType#COUNTER}, registering a {@link Cell} per label value combination
 * that holds a non-decreasing {@code long} value.
 */
public final class Counter extends MetricDescriptor<Counter.Cell> {

    private Counter(Builder builder) {
        super(builder);
    }

    /**
     * Create a builder for a {@link Counter} with the given metric name. <br>
     * Name must match {@value MetricUtils#METRIC_NAME_REGEX}.
     *
     * @param name the name of the metric
     * @return the builder
     */
    @NonNull
    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    @NonNull
    @Override
    protected Cell createCell() {
        return new Cell();
    }

    /**
     * Builder for {@link Counter}.
     */
    public static final class Builder extends MetricDescriptor.Builder<Builder, Counter> {

        private Builder(@NonNull String name) {
            super(MetricType.COUNTER, name);
        }

        @NonNull
        @Override
        protected Counter buildDescriptor() {
            return new Counter(this);
        }
    }

    /**
     * A cell holding a non-decreasing {@code long} value, starting at {@code 0}.
     * Operations are thread-safe and lock-free.
     */
    public static final class Cell extends MetricCell {

        private final LongAdder container = new LongAdder();

        private Cell() {}

        /**
         * Increments the counter by the given amount.
         * The amount is expected to be positive, it is not checked on this hot path.
         *
         * @param amount the value to increment by
         */
        public void increase(long amount) {
            container.add(amount);
        }

        /**
         * Increments the counter by {@code 1}.
         */
        public void increase() {
            container.increment();
        }

        long get() {
            return container.sum();
        }

        @Override
        protected void writeSamples(@NonNull SampleWriter writer) throws IOException {
            writer.writeSample(Long.toString(container.sum()));
        }
    }
}
