// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;

/**
 * Interface for exporting the exposition text of a {@link MetricRegistry}.
 * <p>
 * An exporter is bound to exactly one registry and decides itself when to call
 * {@link MetricRegistry#flush(java.io.OutputStream)}. Flushing is synchronous and serialized by the registry.
 * The registry closes its exporter when the registry is closed.
 *
 * @see MetricsExporterFactory
 */
public interface MetricsExporter extends Closeable {

    /**
     * Binds this exporter to the registry whose metrics it exports.
     *
     * @param registry the registry to export, must not be {@code null}
     */
    void bind(@NonNull MetricRegistry registry);
}
