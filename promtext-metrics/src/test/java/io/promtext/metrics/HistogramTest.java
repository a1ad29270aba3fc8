// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics;

import static io.promtext.metrics.ThreadUtils.runConcurrentAndWait;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.promtext.metrics.core.Buckets;
import io.promtext.metrics.core.MetricRegistry;
import io.promtext.metrics.core.MetricType;
import io.promtext.metrics.core.MetricsException;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class HistogramTest {

    private final MetricRegistry registry = MetricRegistry.builder().build();

    @Nested
    class Building {

        @Test
        void testDefaults() {
            Histogram histogram = Histogram.builder("h").build();

            assertThat(histogram.type()).isEqualTo(MetricType.HISTOGRAM);
            assertThat(histogram.buckets()).isSameAs(Buckets.none());
        }

        @Test
        void testReservedLabelNameThrows() {
            Histogram.Builder explicit = Histogram.builder("h5").setBuckets(1).addLabelNames("le");
            Histogram.Builder linear =
                    Histogram.builder("h5").setBuckets(Buckets.linear(1, 2, 3)).addLabelNames("le");
            Histogram.Builder exponential =
                    Histogram.builder("h5").setBuckets(Buckets.exponential(1, 2, 3)).addLabelNames("le");

            for (Histogram.Builder builder : new Histogram.Builder[] {explicit, linear, exponential}) {
                assertThatThrownBy(builder::build)
                        .isInstanceOf(MetricsException.class)
                        .hasMessage("\"le\" is not allowed as label name in histogram")
                        .extracting(e -> ((MetricsException) e).reason())
                        .isEqualTo(MetricsException.Reason.RESERVED_LABEL_NAME);
            }
        }

        @Test
        void testNullBucketsThrow() {
            Histogram.Builder builder = Histogram.builder("h");

            assertThatThrownBy(() -> builder.setBuckets((Buckets) null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("buckets must not be null");
        }

        @Test
        void testUnorderedBucketsThrow() {
            Histogram.Builder builder = Histogram.builder("h");

            assertThatThrownBy(() -> builder.setBuckets(5, 1))
                    .isInstanceOf(MetricsException.class)
                    .extracting(e -> ((MetricsException) e).reason())
                    .isEqualTo(MetricsException.Reason.UNORDERED_BUCKETS);
        }

        @Test
        void testNegativeOrNullBoundsThrow() {
            Histogram.Builder builder = Histogram.builder("h");

            assertThatThrownBy(() -> builder.setBuckets(-1, 5)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> builder.setBuckets((long[]) null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("bounds must not be null");
        }
    }

    @Nested
    class Observing {

        @Test
        void testCumulativeBuckets() {
            Histogram.Cell cell =
                    Histogram.builder("h").setBuckets(10, 100, 1000).build().register(registry);

            cell.observe(0);
            cell.observe(10);
            cell.observe(11);
            cell.observe(1000);
            cell.observe(5000);

            assertThat(cell.bucketCounts()).containsExactly(2L, 3L, 4L);
            assertThat(cell.count()).isEqualTo(5L);
            assertThat(cell.sum()).isEqualTo(6021L);
        }

        @Test
        void testObservationAboveAllBounds() {
            Histogram.Cell cell =
                    Histogram.builder("h").setBuckets(10, 100, 1000).build().register(registry);

            cell.observe(1500);

            assertThat(cell.bucketCounts()).containsExactly(0L, 0L, 0L);
            assertThat(cell.count()).isEqualTo(1L);
        }

        @Test
        void testNoBucketsWritesOnlyInfBucket() {
            Histogram.Cell cell = Histogram.builder("h").build().register(registry);
            cell.observe(3);
            cell.observe(4);

            assertThat(registry.exposition())
                    .isEqualTo("# HELP h \n# TYPE h histogram\n"
                            + "h_bucket{le=\"+Inf\"} 2\n"
                            + "h_sum 7\n"
                            + "h_count 2\n");
        }

        @Test
        void testLabelsPrecedeLe() {
            Histogram histogram =
                    Histogram.builder("h").setBuckets(1).addLabelNames("path").build();
            histogram.register(registry, "/a").observe(1);

            assertThat(registry.exposition())
                    .contains("h_bucket{path=\"/a\",le=\"1\"} 1\n")
                    .contains("h_bucket{path=\"/a\",le=\"+Inf\"} 1\n")
                    .contains("h_sum{path=\"/a\"} 1\n")
                    .contains("h_count{path=\"/a\"} 1\n");
        }

        @Test
        void testSumWrapsOnOverflow() {
            Histogram.Cell cell = Histogram.builder("h").build().register(registry);

            cell.observe(Long.MAX_VALUE);
            cell.observe(1);

            assertThat(cell.sum()).isEqualTo(Long.MIN_VALUE);
            assertThat(cell.count()).isEqualTo(2L);
        }

        @Test
        void testConcurrentObserve() throws InterruptedException {
            Histogram.Cell cell =
                    Histogram.builder("h").setBuckets(Buckets.linear(0, 10, 10)).build().register(registry);
            int threads = 8;

            runConcurrentAndWait(threads, Duration.ofSeconds(10), idx -> () -> {
                for (int i = 0; i < 100; i++) {
                    cell.observe(i);
                }
            });

            long[] counts = cell.bucketCounts();
            assertThat(cell.count()).isEqualTo(threads * 100L);
            assertThat(cell.sum()).isEqualTo(threads * 4950L);
            assertThat(counts[0]).isEqualTo(threads);
            assertThat(counts[9]).isEqualTo(threads * 91L);
        }
    }
}
