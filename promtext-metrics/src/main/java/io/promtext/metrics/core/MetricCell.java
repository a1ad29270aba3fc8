// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Base class for the live state of one series: the object application code mutates on the hot path.
 * <p>
 * A cell is created by {@link MetricDescriptor#createCell()} when a series is registered and is owned by the
 * {@link MetricRegistry} for the rest of the process lifetime. Implementations must be thread-safe:
 * mutators are called concurrently with each other and with {@link #writeSamples(SampleWriter)}.
 */
public abstract class MetricCell {

    /**
     * Writes the current state of this cell as exposition sample lines.
     * <p>
     * This method is protected to keep it out of the public API of concrete cells.
     * It is only called by the registry during a flush.
     *
     * @param writer the writer bound to the series name and labels of this cell
     * @throws IOException if the underlying sink fails
     */
    protected abstract void writeSamples(@NonNull SampleWriter writer) throws IOException;
}
