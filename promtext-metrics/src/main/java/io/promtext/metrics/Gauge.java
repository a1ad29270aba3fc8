// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.promtext.metrics.core.MetricCell;
import io.promtext.metrics.core.MetricDescriptor;
import io.promtext.metrics.core.MetricType;
import io.promtext.metrics.core.MetricUtils;
import io.promtext.metrics.core.SampleWriter;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A metric of type {@link MetricType#GAUGE}, registering a {@link Cell} per label value combination
 * that holds a {@code long} value which can go up and down.
 *
 * @see DoubleGauge
 */
public final class Gauge extends MetricDescriptor<Gauge.Cell> {

    private Gauge(Builder builder) {
        super(builder);
    }

    /**
     * Create a builder for a {@link Gauge} with the given metric name. <br>
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
     * Builder for {@link Gauge}.
     */
    public static final class Builder extends MetricDescriptor.Builder<Builder, Gauge> {

        private Builder(@NonNull String name) {
            super(MetricType.GAUGE, name);
        }

        @NonNull
        @Override
        protected Gauge buildDescriptor() {
            return new Gauge(this);
        }
    }

    /**
     * A cell holding a {@code long} value, starting at {@code 0}.
     * Operations are thread-safe and atomic.
     */
    public static final class Cell extends MetricCell {

        private final AtomicLong container = new AtomicLong();

        private Cell() {}

        /**
         * Adds the given delta to the gauge.
         *
         * @param delta the value to add
         */
        public void increase(long delta) {
            container.addAndGet(delta);
        }

        /**
         * Adds {@code 1} to the gauge.
         */
        public void increase() {
            container.incrementAndGet();
        }

        /**
         * Subtracts the given delta from the gauge.
         *
         * @param delta the value to subtract
         */
        public void decrease(long delta) {
            container.addAndGet(-delta);
        }

        /**
         * Subtracts {@code 1} from the gauge.
         */
        public void decrease() {
            container.decrementAndGet();
        }

        /**
         * Sets the gauge to the given value.
         *
         * @param value the new value
         */
        public void set(long value) {
            container.set(value);
        }

        long get() {
            return container.get();
        }

        @Override
        protected void writeSamples(@NonNull SampleWriter writer) throws IOException {
            writer.writeSample(Long.toString(container.get()));
        }
    }
}
