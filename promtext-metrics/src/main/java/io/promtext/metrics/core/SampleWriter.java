// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * Writes sample lines of a single series to an exposition sink.
 * <p>
 * Instances are bound to the series name and its rendered labels, so a {@link MetricCell} only supplies
 * the suffix, the extra {@code le} bound for bucket lines, and the value.
 * Braces are omitted when a line has no labels at all.
 */
public final class SampleWriter {

    private static final String BUCKET_SUFFIX = "_bucket";
    private static final String LE_PREFIX = "le=\"";
    private static final String INFINITY = "+Inf";

    private final Appendable out;
    private final String name;
    private final String labels;

    SampleWriter(@NonNull Appendable out, @NonNull String name, @NonNull String labels) {
        this.out = out;
        this.name = name;
        this.labels = labels;
    }

    /**
     * Writes {@code name{labels} value}.
     */
    public void writeSample(@NonNull String value) throws IOException {
        writeSample("", value);
    }

    /**
     * Writes {@code name<suffix>{labels} value}.
     */
    public void writeSample(@NonNull String suffix, @NonNull String value) throws IOException {
        out.append(name).append(suffix);
        if (!labels.isEmpty()) {
            out.append('{').append(labels).append('}');
        }
        out.append(' ').append(value).append('\n');
    }

    /**
     * Writes {@code name_bucket{labels,le="bound"} count}.
     */
    public void writeBucket(long bound, long count) throws IOException {
        writeBucket(Long.toString(bound), count);
    }

    /**
     * Writes {@code name_bucket{labels,le="+Inf"} count}.
     */
    public void writeInfBucket(long count) throws IOException {
        writeBucket(INFINITY, count);
    }

    private void writeBucket(String bound, long count) throws IOException {
        out.append(name).append(BUCKET_SUFFIX).append('{');
        if (!labels.isEmpty()) {
            out.append(labels).append(',');
        }
        out.append(LE_PREFIX).append(bound).append("\"} ");
        out.append(Long.toString(count)).append('\n');
    }
}
