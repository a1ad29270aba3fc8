// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The kind of a metric family, as written on its {@code # TYPE} line.
 */
public enum MetricType {
    /**
     * A cumulative metric that represents a single monotonically increasing counter value.
     */
    COUNTER("counter"),
    /**
     * A metric that represents a single numerical value that can arbitrarily go up and down and set to any value.
     */
    GAUGE("gauge"),
    /**
     * A metric that samples observations into cumulative buckets and tracks their sum and count.
     */
    HISTOGRAM("histogram");

    private final String exposedName;

    MetricType(String exposedName) {
        this.exposedName = exposedName;
    }

    /**
     * @return the lower case name used in the exposition format, never {@code null}
     */
    @NonNull
    public String exposedName() {
        return exposedName;
    }
}
