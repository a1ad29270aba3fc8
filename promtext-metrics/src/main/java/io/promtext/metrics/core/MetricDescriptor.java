// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import static io.promtext.metrics.core.MetricsException.Reason.DUPLICATE_LABEL_NAME;
import static io.promtext.metrics.core.MetricsException.Reason.LABEL_COUNT_MISMATCH;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for all metric descriptors.
 * <p>
 * A descriptor is the immutable template of a metric family: name, type, help text and label names.
 * Label names are kept sorted alphabetically as {@link LabelKey}s, each remembering its declared position,
 * so label values can be passed in declaration order and are still rendered in a deterministic order.
 * <p>
 * A descriptor is typically built once at startup and then registered in a {@link MetricRegistry} once per
 * label value combination. Each registration creates a new {@link MetricCell} of type {@code C}.
 * Subclasses extending this class must provide their own builder extending {@link Builder}.
 *
 * @param <C> the type of cell created for each registered series
 */
public abstract class MetricDescriptor<C extends MetricCell> {

    @NonNull
    private final MetricType type;

    @NonNull
    private final String name;

    @NonNull
    private final String help;

    private final List<LabelKey> labelKeys;

    protected MetricDescriptor(@NonNull Builder<?, ?> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        type = builder.type;
        name = builder.name;
        help = builder.help;

        final List<LabelKey> keys = new ArrayList<>(builder.labelNames.size());
        for (int i = 0; i < builder.labelNames.size(); i++) {
            keys.add(new LabelKey(builder.labelNames.get(i), i));
        }
        keys.sort(null);
        for (int i = 1; i < keys.size(); i++) {
            if (keys.get(i - 1).name().equals(keys.get(i).name())) {
                throw new MetricsException(DUPLICATE_LABEL_NAME, "Metric '" + name + "' has duplicate label names");
            }
        }
        labelKeys = List.copyOf(keys);
    }

    /**
     * @return the metric type, never {@code null}
     */
    @NonNull
    public final MetricType type() {
        return type;
    }

    /**
     * @return the metric name, never {@code null}
     */
    @NonNull
    public final String name() {
        return name;
    }

    /**
     * @return the help text, empty if not set, never {@code null}
     */
    @NonNull
    public final String help() {
        return help;
    }

    /**
     * @return unmodifiable list of label keys sorted by name, may be empty but never {@code null}
     */
    @NonNull
    public final List<LabelKey> labelKeys() {
        return labelKeys;
    }

    /**
     * Registers a new series of this metric in the given registry.
     *
     * @param registry    the registry, must not be {@code null}
     * @param labelValues label values in the order the label names were declared
     * @return the cell of the new series, never {@code null}
     * @throws MetricsException if the number of values is wrong, or the series conflicts with registered ones
     * @see MetricRegistry#register(MetricDescriptor, String...)
     */
    @NonNull
    public final C register(@NonNull MetricRegistry registry, @NonNull String... labelValues) {
        Objects.requireNonNull(registry, "registry must not be null");
        return registry.register(this, labelValues);
    }

    /**
     * Registers a new series of this metric in the {@link MetricRegistry#global() global} registry.
     *
     * @param labelValues label values in the order the label names were declared
     * @return the cell of the new series, never {@code null}
     * @throws MetricsException if the number of values is wrong, or the series conflicts with registered ones
     */
    @NonNull
    public final C register(@NonNull String... labelValues) {
        return register(MetricRegistry.global(), labelValues);
    }

    /**
     * Renders label values as {@code k1="v1",k2="v2"} in sorted label name order.
     *
     * @param labelValues label values in the order the label names were declared
     * @return the rendered labels, empty if the metric has no labels
     * @throws MetricsException     with {@link MetricsException.Reason#LABEL_COUNT_MISMATCH}
     *                              if the number of values differs from the number of label names
     * @throws NullPointerException if any value is {@code null}
     */
    @NonNull
    final String renderLabels(@NonNull String... labelValues) {
        Objects.requireNonNull(labelValues, "label values must not be null");
        if (labelValues.length != labelKeys.size()) {
            throw new MetricsException(
                    LABEL_COUNT_MISMATCH,
                    "Key/value mismatch for metric '" + name + "': expected " + labelKeys.size()
                            + " label values, got " + labelValues.length);
        }
        if (labelKeys.isEmpty()) {
            return "";
        }

        final StringBuilder sb = new StringBuilder(labelKeys.size() * 16);
        for (LabelKey key : labelKeys) {
            final String value = labelValues[key.index()];
            if (value == null) {
                throw new NullPointerException("Label value must not be null for label: " + key.name());
            }
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(key.name()).append("=\"").append(MetricUtils.escapeLabelValue(value)).append('"');
        }
        return sb.toString();
    }

    /**
     * Creates a new cell in its initial state.
     * <p>
     * This method is protected to avoid exposing it in the public API and only called from the metric registry
     * when a new series is registered.
     *
     * @return the new cell, never {@code null}
     */
    @NonNull
    protected abstract C createCell();

    @Override
    public final String toString() {
        return "type=" + type + ", name='" + name + "', help='" + help + "', labelKeys=" + labelKeys;
    }

    /**
     * Base builder class for constructing {@link MetricDescriptor} instances.
     *
     * @param <B> the concrete builder type to return for method chaining
     * @param <D> the concrete descriptor type to build
     */
    public abstract static class Builder<B extends Builder<B, D>, D extends MetricDescriptor<?>> {

        private final MetricType type;
        private final String name;
        private String help = "";
        private final List<String> labelNames = new ArrayList<>();

        /**
         * Constructor for a descriptor builder.
         *
         * @param type the metric type, must not be {@code null}
         * @param name the metric name, must match {@value MetricUtils#METRIC_NAME_REGEX}
         * @throws NullPointerException     if any of the parameters is {@code null}
         * @throws IllegalArgumentException if the name contains illegal characters
         */
        protected Builder(@NonNull MetricType type, @NonNull String name) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.name = MetricUtils.validateMetricNameCharacters(name);
        }

        /**
         * Sets the help text written on the {@code # HELP} line.
         *
         * @param help the help text, {@code null} is treated as empty
         * @return the builder instance
         */
        @NonNull
        public final B setHelp(@Nullable String help) {
            this.help = help == null ? "" : help;
            return self();
        }

        /**
         * Appends label names. The declared order defines the order of label values on registration.
         * Duplicates are reported when the descriptor is built.
         *
         * @param labelNames the label names to add, must not be {@code null}
         * @return the builder instance
         * @throws NullPointerException     if any label name is {@code null}
         * @throws IllegalArgumentException if any label name doesn't match regex {@value MetricUtils#LABEL_NAME_REGEX}
         */
        @NonNull
        public final B addLabelNames(@NonNull String... labelNames) {
            Objects.requireNonNull(labelNames, "label names must not be null");
            for (String labelName : labelNames) {
                this.labelNames.add(MetricUtils.validateLabelNameCharacters(labelName));
            }
            return self();
        }

        /**
         * @return the label names added so far in declared order
         */
        @NonNull
        protected final List<String> labelNames() {
            return List.copyOf(labelNames);
        }

        /**
         * Builds the descriptor.
         *
         * @return the built descriptor, never {@code null}
         * @throws MetricsException if label names are duplicated, or the concrete type rejects its configuration
         */
        @NonNull
        public final D build() {
            return buildDescriptor();
        }

        /**
         * Builds the descriptor instance. Subclasses must implement this method to create the specific type.
         *
         * @return the built descriptor, never {@code null}
         */
        @NonNull
        protected abstract D buildDescriptor();

        /**
         * @return the builder instance concrete type to support fluent API
         */
        @NonNull
        @SuppressWarnings("unchecked")
        protected final B self() {
            return (B) this;
        }
    }
}
