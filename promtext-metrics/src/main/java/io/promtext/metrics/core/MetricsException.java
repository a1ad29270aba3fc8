// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Thrown when a metric definition or registration violates one of the registry rules.
 * <p>
 * These are programmer errors: they are raised synchronously by the call that detects them and are never
 * retried or corrected internally. {@link #reason()} tells which rule was broken.
 */
public class MetricsException extends IllegalArgumentException {

    /**
     * The rule that was violated.
     */
    public enum Reason {
        /** Descriptor declares the same label name twice. */
        DUPLICATE_LABEL_NAME,
        /** Histogram declares label name {@code le}. */
        RESERVED_LABEL_NAME,
        /** Explicit bucket bounds are not strictly increasing. */
        UNORDERED_BUCKETS,
        /** Linear delta is below 1 or exponential factor is not above 1. */
        INVALID_DELTA,
        /** Generated bucket bound does not fit into {@code long}. */
        BUCKET_OVERFLOW,
        /** Exponential bounds collapsed to the same value after flooring. */
        DUPLICATE_BUCKET,
        /** Number of label values differs from the number of label names. */
        LABEL_COUNT_MISMATCH,
        /** Metric name is already used by a metric of another type. */
        METRIC_KIND_AMBIGUOUS,
        /** Metric name and label values are already registered. */
        DUPLICATE_SERIES
    }

    private final Reason reason;

    public MetricsException(@NonNull Reason reason, @NonNull String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * @return the violated rule, never {@code null}
     */
    @NonNull
    public Reason reason() {
        return reason;
    }
}
