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
 * that holds a {@code double} value which can go up and down.
 * <p>
 * It belongs to the same metric type as {@link Gauge}, so both can share a family name.
 */
public final class DoubleGauge extends MetricDescriptor<DoubleGauge.Cell> {

    private DoubleGauge(Builder builder) {
        super(builder);
    }

    /**
     * Create a builder for a {@link DoubleGauge} with the given metric name. <br>
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
     * Builder for {@link DoubleGauge}.
     */
    public static final class Builder extends MetricDescriptor.Builder<Builder, DoubleGauge> {

        private Builder(@NonNull String name) {
            super(MetricType.GAUGE, name);
        }

        @NonNull
        @Override
        protected DoubleGauge buildDescriptor() {
            return new DoubleGauge(this);
        }
    }

    /**
     * A cell holding a {@code double} value, starting at {@code 0.0}.
     * The value is kept as raw bits in an {@link AtomicLong}, so operations are thread-safe and lock-free.
     */
    public static final class Cell extends MetricCell {

        private final AtomicLong container = new AtomicLong(fromDouble(0.0));

        private Cell() {}

        /**
         * Adds the given delta to the gauge.
         *
         * @param delta the value to add
         */
        public void increase(double delta) {
            container.accumulateAndGet(fromDouble(delta), (prev, d) -> fromDouble(toDouble(prev) + toDouble(d)));
        }

        /**
         * Adds {@code 1.0} to the gauge.
         */
        public void increase() {
            increase(1.0);
        }

        /**
         * Subtracts the given delta from the gauge.
         *
         * @param delta the value to subtract
         */
        public void decrease(double delta) {
            increase(-delta);
        }

        /**
         * Subtracts {@code 1.0} from the gauge.
         */
        public void decrease() {
            increase(-1.0);
        }

        /**
         * Sets the gauge to the given value.
         *
         * @param value the new value
         */
        public void set(double value) {
            container.set(fromDouble(value));
        }

        double get() {
            return toDouble(container.get());
        }

        @Override
        protected void writeSamples(@NonNull SampleWriter writer) throws IOException {
            writer.writeSample(MetricUtils.formatValue(get()));
        }

        private static long fromDouble(double value) {
            return Double.doubleToRawLongBits(value);
        }

        private static double toDouble(long value) {
            return Double.longBitsToDouble(value);
        }
    }
}
