// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.textfile.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/**
 * Configuration for the text file exporter, read from properties prefixed with {@value #PREFIX}.
 *
 * @param enabled whether the exporter is enabled (default: false)
 * @param path the file to write the exposition text to (default: metrics.prom)
 * @param intervalSeconds the interval between two writes (default: 15, min: 1)
 */
public record TextFileExporterConfig(boolean enabled, @NonNull String path, int intervalSeconds) {

    public static final String PREFIX = "metrics.exporter.textfile";

    private static final String ENABLED = PREFIX + ".enabled";
    private static final String PATH = PREFIX + ".path";
    private static final String INTERVAL_SECONDS = PREFIX + ".intervalSeconds";

    public TextFileExporterConfig {
        Objects.requireNonNull(path, "path must not be null");
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException(INTERVAL_SECONDS + " must be at least 1, got " + intervalSeconds);
        }
    }

    /**
     * Reads the exporter configuration, using defaults for absent properties.
     *
     * @param config the configuration source, must not be {@code null}
     * @return the exporter configuration
     * @throws IllegalArgumentException if a property can't be converted or the interval is less than 1
     */
    @NonNull
    public static TextFileExporterConfig from(@NonNull Config config) {
        Objects.requireNonNull(config, "configuration must not be null");
        return new TextFileExporterConfig(
                config.getOptionalValue(ENABLED, Boolean.class).orElse(false),
                config.getOptionalValue(PATH, String.class).orElse("metrics.prom"),
                config.getOptionalValue(INTERVAL_SECONDS, Integer.class).orElse(15));
    }
}
