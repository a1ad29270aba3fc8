// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.textfile;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import io.promtext.metrics.core.MetricsExporter;
import io.promtext.metrics.core.MetricsExporterFactory;
import io.promtext.metrics.textfile.config.TextFileExporterConfig;
import java.nio.file.Path;
import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/**
 * Implementation of {@link MetricsExporterFactory} for creating {@link TextFileExporter}s.
 * Uses {@link TextFileExporterConfig} for configuration.
 */
public final class TextFileExporterFactory implements MetricsExporterFactory {

    @Nullable
    @Override
    public MetricsExporter createExporter(@NonNull Config configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        final TextFileExporterConfig config = TextFileExporterConfig.from(configuration);

        if (!config.enabled()) {
            return null;
        }

        return new TextFileExporter(Path.of(config.path()), config.intervalSeconds());
    }
}
