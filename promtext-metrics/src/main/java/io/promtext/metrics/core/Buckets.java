// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import static io.promtext.metrics.core.MetricsException.Reason.BUCKET_OVERFLOW;
import static io.promtext.metrics.core.MetricsException.Reason.DUPLICATE_BUCKET;
import static io.promtext.metrics.core.MetricsException.Reason.INVALID_DELTA;
import static io.promtext.metrics.core.MetricsException.Reason.UNORDERED_BUCKETS;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, strictly increasing sequence of histogram bucket upper bounds.
 * <p>
 * Bounds are inclusive ({@code le}) non-negative integers, so observation is exact integer arithmetic.
 * The implicit {@code +Inf} bucket is never part of the set. An empty set is legal.
 * <p>
 * Instances are created by one of the factory methods:
 * <ul>
 *     <li>{@link #of(long...)} - explicit bounds, validated for strict increase</li>
 *     <li>{@link #linear(long, long, int)} - {@code start, start + delta, start + 2 * delta, ...}</li>
 *     <li>{@link #exponential(long, double, int)} - {@code start, floor(start * factor), ...}</li>
 *     <li>{@link #none()} - no bounds</li>
 * </ul>
 */
public final class Buckets {

    private static final Buckets NONE = new Buckets(new long[0]);

    // 2^63, the smallest double not representable as long
    private static final double LONG_RANGE_LIMIT = 0x1p63;

    private final long[] bounds;

    private Buckets(long[] bounds) {
        this.bounds = bounds;
    }

    /**
     * @return bucket set without bounds, histograms using it only have the {@code +Inf} bucket
     */
    @NonNull
    public static Buckets none() {
        return NONE;
    }

    /**
     * Creates a bucket set from explicit bounds.
     *
     * @param bounds the bounds, must be strictly increasing and non-negative
     * @return the bucket set
     * @throws NullPointerException     if bounds is {@code null}
     * @throws IllegalArgumentException if any bound is negative
     * @throws MetricsException         with {@link MetricsException.Reason#UNORDERED_BUCKETS}
     *                                  if bounds are not strictly increasing
     */
    @NonNull
    public static Buckets of(@NonNull long... bounds) {
        Objects.requireNonNull(bounds, "bounds must not be null");
        if (bounds.length == 0) {
            return NONE;
        }
        if (bounds[0] < 0L) {
            throw new IllegalArgumentException("Bucket bounds must be non-negative: " + Arrays.toString(bounds));
        }
        for (int i = 1; i < bounds.length; i++) {
            if (bounds[i - 1] >= bounds[i]) {
                throw new MetricsException(
                        UNORDERED_BUCKETS, "Buckets must be in increasing order: " + Arrays.toString(bounds));
            }
        }
        return new Buckets(bounds.clone());
    }

    /**
     * Creates {@code count} bounds growing by a constant {@code delta}.
     *
     * @param start the first bound, must be non-negative
     * @param delta the distance between two neighbour bounds, must be at least {@code 1}
     * @param count the number of bounds, must be non-negative
     * @return the bucket set
     * @throws IllegalArgumentException if start or count is negative
     * @throws MetricsException         with {@link MetricsException.Reason#INVALID_DELTA} if delta is less than 1,
     *                                  or {@link MetricsException.Reason#BUCKET_OVERFLOW} if a bound exceeds {@link Long#MAX_VALUE}
     */
    @NonNull
    public static Buckets linear(long start, long delta, int count) {
        if (delta < 1L) {
            throw new MetricsException(INVALID_DELTA, "Linear buckets delta must be not less than 1: " + delta);
        }
        checkStartAndCount(start, count);
        if (count == 0) {
            return NONE;
        }

        final long[] bounds = new long[count];
        long le = start;
        bounds[0] = le;
        for (int i = 1; i < count; i++) {
            if (le > Long.MAX_VALUE - delta) {
                throw new MetricsException(BUCKET_OVERFLOW, "Linear buckets boundaries overflow at index " + i);
            }
            le += delta;
            bounds[i] = le;
        }
        return new Buckets(bounds);
    }

    /**
     * Creates {@code count} bounds where each bound is the previous one multiplied by {@code factor},
     * rounded down to an integer.
     *
     * @param start  the first bound, must be non-negative
     * @param factor the growth factor, must be greater than {@code 1}
     * @param count  the number of bounds, must be non-negative
     * @return the bucket set
     * @throws IllegalArgumentException if start or count is negative
     * @throws MetricsException         with {@link MetricsException.Reason#INVALID_DELTA} if factor is not greater than 1,
     *                                  {@link MetricsException.Reason#BUCKET_OVERFLOW} if a bound exceeds {@link Long#MAX_VALUE},
     *                                  or {@link MetricsException.Reason#DUPLICATE_BUCKET} if rounding produced the same bound twice
     */
    @NonNull
    public static Buckets exponential(long start, double factor, int count) {
        if (!(factor > 1.0)) {
            throw new MetricsException(INVALID_DELTA, "Exponential buckets factor must be greater than 1: " + factor);
        }
        checkStartAndCount(start, count);
        if (count == 0) {
            return NONE;
        }

        final long[] bounds = new long[count];
        long le = start;
        bounds[0] = le;
        for (int i = 1; i < count; i++) {
            final double next = Math.floor(le * factor);
            if (next >= LONG_RANGE_LIMIT) {
                throw new MetricsException(BUCKET_OVERFLOW, "Exponential buckets boundaries overflow at index " + i);
            }
            le = (long) next;
            if (le == bounds[i - 1]) {
                throw new MetricsException(
                        DUPLICATE_BUCKET,
                        "Exponential buckets got duplicate bound " + le + ", try to increase the factor");
            }
            bounds[i] = le;
        }
        return new Buckets(bounds);
    }

    private static void checkStartAndCount(long start, int count) {
        if (start < 0L) {
            throw new IllegalArgumentException("Buckets start must be non-negative: " + start);
        }
        if (count < 0) {
            throw new IllegalArgumentException("Buckets count must be non-negative: " + count);
        }
    }

    /**
     * @return number of bounds, not counting the implicit {@code +Inf} bucket
     */
    public int size() {
        return bounds.length;
    }

    /**
     * @return {@code true} if there are no bounds
     */
    public boolean isEmpty() {
        return bounds.length == 0;
    }

    /**
     * @param index the bound index
     * @return the bound at the given index
     * @throws ArrayIndexOutOfBoundsException if index is out of range
     */
    public long get(int index) {
        return bounds[index];
    }

    /**
     * @return a copy of the bounds in ascending order
     */
    @NonNull
    public long[] toArray() {
        return bounds.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Buckets that && Arrays.equals(bounds, that.bounds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bounds);
    }

    @Override
    public String toString() {
        return Arrays.toString(bounds);
    }
}
