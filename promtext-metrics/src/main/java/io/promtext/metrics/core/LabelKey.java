// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A label name paired with the position it was declared at.
 * <p>
 * {@link MetricDescriptor} keeps its keys sorted by name, while callers pass label values in declaration order.
 * The {@code index} maps a sorted key back to the matching value.
 *
 * @param name  the label name
 * @param index the position of the label name in the declared order
 */
public record LabelKey(@NonNull String name, int index) implements Comparable<LabelKey> {

    @Override
    public int compareTo(LabelKey other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
