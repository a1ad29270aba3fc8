// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/**
 * Configuration for the {@link MetricRegistry}, read from properties prefixed with {@value #PREFIX}.
 *
 * @param exporterDiscoveryEnabled whether exporter factories are discovered via service loader (default: true)
 */
public record MetricsRegistryConfig(boolean exporterDiscoveryEnabled) {

    public static final String PREFIX = "metrics.registry";

    static final String EXPORTER_DISCOVERY_ENABLED = PREFIX + ".exporterDiscoveryEnabled";

    /**
     * Reads the registry configuration, using defaults for absent properties.
     *
     * @param config the configuration source, must not be {@code null}
     * @return the registry configuration
     */
    @NonNull
    public static MetricsRegistryConfig from(@NonNull Config config) {
        Objects.requireNonNull(config, "configuration must not be null");
        return new MetricsRegistryConfig(
                config.getOptionalValue(EXPORTER_DISCOVERY_ENABLED, Boolean.class).orElse(true));
    }
}
