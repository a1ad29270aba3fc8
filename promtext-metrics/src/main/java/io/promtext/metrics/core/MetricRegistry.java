// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import static io.promtext.metrics.core.MetricsException.Reason.DUPLICATE_SERIES;
import static io.promtext.metrics.core.MetricsException.Reason.METRIC_KIND_AMBIGUOUS;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.microprofile.config.Config;

/**
 * A thread-safe registry of metric families, that registers series of {@link MetricDescriptor}s and writes
 * all of them in the Prometheus text exposition format.
 * <p>
 * Series sharing a name form a family. All series of a family must have the same {@link MetricType} and
 * distinct label values. Families are written in name order, series of a family in registration order,
 * with the help text and type of the first registered series.
 * <p>
 * {@link #register(MetricDescriptor, String...)} and {@link #flush(Appendable)} are serialized by the registry
 * monitor. Mutating cells of already registered series never touches the registry.
 * <p>
 * A process wide instance is available via {@link #global()}. Independent instances are created via
 * {@link #builder()}. A registry can optionally be associated with a {@link MetricsExporter}
 * that is closed together with the registry.
 */
public final class MetricRegistry implements Closeable {

    private static final Logger logger = LogManager.getLogger(MetricRegistry.class);

    private static final String HELP_PREFIX = "# HELP ";
    private static final String TYPE_PREFIX = "# TYPE ";

    private final Map<String, Family> families = new TreeMap<>();

    @Nullable
    private final MetricsExporter exporter;

    private MetricRegistry(@Nullable MetricsExporter exporter) {
        this.exporter = exporter;
    }

    /**
     * @return the process wide registry, created on first access
     */
    @NonNull
    public static MetricRegistry global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * @return a new {@link Builder} for constructing {@link MetricRegistry} instance
     */
    @NonNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if this registry has an associated {@link MetricsExporter}, {@code false} otherwise
     */
    public boolean hasMetricsExporter() {
        return exporter != null;
    }

    /**
     * Registers a new series of the given descriptor and returns its cell.
     * <p>
     * This method is <b>not idempotent</b>: registering the same label values twice fails.
     *
     * @param descriptor  the metric descriptor, must not be {@code null}
     * @param labelValues label values in the order the label names of the descriptor were declared
     * @param <C>         the cell type
     * @return the cell of the registered series, never {@code null}
     * @throws NullPointerException if the descriptor, the values array or any value is {@code null}
     * @throws MetricsException     with {@link MetricsException.Reason#LABEL_COUNT_MISMATCH} if the number of
     *                              values is wrong, {@link MetricsException.Reason#METRIC_KIND_AMBIGUOUS} if the
     *                              name is registered with another type, or {@link MetricsException.Reason#DUPLICATE_SERIES}
     *                              if the same label values are already registered under this name
     */
    @NonNull
    public synchronized <C extends MetricCell> C register(
            @NonNull MetricDescriptor<C> descriptor, @NonNull String... labelValues) {
        Objects.requireNonNull(descriptor, "metric descriptor must not be null");

        final Series<C> series = new Series<>(descriptor, labelValues);
        final Family family = families.get(descriptor.name());
        if (family == null) {
            families.put(descriptor.name(), new Family(series));
        } else {
            family.add(series);
        }

        logger.debug("Registered series. name={}, labels={}", descriptor.name(), series.labels());
        return series.cell();
    }

    /**
     * Writes all registered series in the text exposition format.
     * <p>
     * The registry is locked for the whole pass, so no series is registered while it is written.
     * Cells keep being updated concurrently, so values of different series may be captured at slightly
     * different instants.
     *
     * @param out the sink to write to, must not be {@code null}
     * @throws IOException if the sink fails, the output may then be partially written
     */
    public synchronized void flush(@NonNull Appendable out) throws IOException {
        Objects.requireNonNull(out, "output must not be null");
        for (Family family : families.values()) {
            family.writeTo(out);
        }
    }

    /**
     * Writes all registered series in the text exposition format as UTF-8.
     * The stream is flushed, but not closed.
     *
     * @param out the stream to write to, must not be {@code null}
     * @throws IOException if the stream fails
     * @see #flush(Appendable)
     */
    public void flush(@NonNull OutputStream out) throws IOException {
        Objects.requireNonNull(out, "output stream must not be null");
        final Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        flush(writer);
        writer.flush();
    }

    /**
     * @return the exposition text of all registered series
     * @see #flush(Appendable)
     */
    @NonNull
    public String exposition() {
        final StringBuilder sb = new StringBuilder();
        try {
            flush(sb);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    /**
     * @return names of all registered families in exposition order
     */
    @NonNull
    public synchronized List<String> familyNames() {
        return List.copyOf(families.keySet());
    }

    /**
     * @param name the family name
     * @return number of series registered under the given name, {@code 0} if there are none
     */
    public synchronized int seriesCount(@NonNull String name) {
        final Family family = families.get(name);
        return family == null ? 0 : family.series.size();
    }

    @Override
    public void close() throws IOException {
        if (exporter != null) {
            logger.info("Closing metrics exporter: {}", exporter.getClass());
            exporter.close();
        }
    }

    /**
     * All series sharing one name, in registration order.
     */
    private static final class Family {

        private final String name;
        private final MetricType type;
        private final String help;
        private final List<Series<?>> series = new ArrayList<>();
        private final Set<String> labelSets = new HashSet<>();

        private Family(Series<?> first) {
            name = first.descriptor().name();
            type = first.descriptor().type();
            help = first.descriptor().help();
            series.add(first);
            labelSets.add(first.labels());
        }

        private void add(Series<?> newSeries) {
            if (newSeries.descriptor().type() != type) {
                throw new MetricsException(
                        METRIC_KIND_AMBIGUOUS,
                        "Metric '" + name + "' type is ambiguous: registered as " + type.exposedName() + ", got "
                                + newSeries.descriptor().type().exposedName());
            }
            if (!labelSets.add(newSeries.labels())) {
                throw new MetricsException(
                        DUPLICATE_SERIES, "Metric '" + name + "' has duplicate labels: {" + newSeries.labels() + "}");
            }
            series.add(newSeries);
        }

        private void writeTo(Appendable out) throws IOException {
            out.append(HELP_PREFIX).append(name).append(' ').append(MetricUtils.escapeHelp(help)).append('\n');
            out.append(TYPE_PREFIX).append(name).append(' ').append(type.exposedName()).append('\n');
            for (Series<?> s : series) {
                s.writeTo(out);
            }
        }
    }

    private static final class GlobalHolder {
        private static final MetricRegistry INSTANCE = builder().build();
    }

    /**
     * Builder for constructing {@link MetricRegistry} instances.
     */
    public static final class Builder {

        private MetricsExporter metricsExporter;
        private Config configuration;

        private Builder() {}

        /**
         * Sets the {@link MetricsExporter} to be associated with the registry.
         *
         * @param metricsExporter the metrics exporter, must not be {@code null}
         * @return this builder instance
         * @throws NullPointerException if the metrics exporter is {@code null}
         */
        @NonNull
        public Builder setMetricsExporter(@NonNull MetricsExporter metricsExporter) {
            this.metricsExporter = Objects.requireNonNull(metricsExporter, "metrics exporter must not be null");
            return this;
        }

        /**
         * Enables discovery of a {@link MetricsExporterFactory} implementation that creates {@link MetricsExporter}
         * using the provided configuration.
         * Actual discovery happens during the {@link #build()} call and if successful, overrides exporter set
         * by {@link #setMetricsExporter(MetricsExporter)}.
         *
         * @param configuration the configuration to use for creating an instance of {@link MetricsExporter}, must not be {@code null}
         * @return this builder instance
         * @throws NullPointerException if the configuration is {@code null}
         */
        @NonNull
        public Builder discoverMetricsExporter(@NonNull Config configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
            return this;
        }

        /**
         * Builds the {@link MetricRegistry} instance.
         * <p>
         * If exporter discovery is enabled via {@link #discoverMetricsExporter(Config)} and not disabled by
         * {@link MetricsRegistryConfig#exporterDiscoveryEnabled()}, it attempts to discover a single
         * {@link MetricsExporterFactory} via service loader and create an exporter using it.
         * If multiple factories are found, they are ignored and a warning is logged.
         * The resulting exporter, if any, is bound to the new registry.
         *
         * @return the constructed {@link MetricRegistry}
         */
        @NonNull
        public MetricRegistry build() {
            if (configuration != null) {
                discoverExporter(configuration);
            }

            final MetricRegistry registry = new MetricRegistry(metricsExporter);
            if (metricsExporter != null) {
                metricsExporter.bind(registry);
                logger.info("Created metric registry. exporter={}", metricsExporter.getClass());
            } else {
                logger.info("Created metric registry without exporter");
            }
            return registry;
        }

        private void discoverExporter(Config configuration) {
            final MetricsRegistryConfig config = MetricsRegistryConfig.from(configuration);
            if (!config.exporterDiscoveryEnabled()) {
                logger.info("Exporter discovery is disabled by configuration");
                return;
            }

            final List<MetricsExporterFactory> factories = MetricUtils.load(MetricsExporterFactory.class);
            if (factories.size() > 1) {
                logger.warn(
                        "Multiple metrics exporter factories found: {}. "
                                + "Expected at most one. Ignoring discovered exporter factories.",
                        factories);
            } else if (factories.size() == 1) {
                final MetricsExporterFactory factory = factories.get(0);
                final MetricsExporter exporter = factory.createExporter(configuration);
                if (exporter != null) {
                    this.metricsExporter = exporter;
                } else {
                    logger.info("Exporter factory did not create an exporter: {}", factory.getClass());
                }
            }
        }
    }
}
