// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * One registered label value combination of a metric family, backed by its own cell.
 * <p>
 * Labels are rendered once at registration and reused unchanged on every flush.
 * Within a family, the rendered labels identify the series.
 *
 * @param <C> the cell type
 */
final class Series<C extends MetricCell> {

    private final MetricDescriptor<C> descriptor;
    private final String labels;
    private final C cell;

    Series(@NonNull MetricDescriptor<C> descriptor, @NonNull String... labelValues) {
        this.descriptor = descriptor;
        this.labels = descriptor.renderLabels(labelValues);
        this.cell = descriptor.createCell();
    }

    /**
     * @return the descriptor this series was registered with
     */
    @NonNull
    MetricDescriptor<C> descriptor() {
        return descriptor;
    }

    /**
     * @return the rendered labels, {@code k1="v1",k2="v2"}, empty if there are no labels
     */
    @NonNull
    String labels() {
        return labels;
    }

    /**
     * @return the live cell of this series
     */
    @NonNull
    C cell() {
        return cell;
    }

    void writeTo(@NonNull Appendable out) throws IOException {
        cell.writeSamples(new SampleWriter(out, descriptor.name(), labels));
    }
}
