// SPDX-License-Identifier: Apache-2.0
package io.promtext.metrics.textfile;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

import edu.umd.cs.findbugs.annotations.NonNull;
import io.promtext.metrics.core.MetricRegistry;
import io.promtext.metrics.core.MetricsExporter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link MetricsExporter} that periodically writes the exposition text of its registry to a file,
 * for a text file collector to pick up.
 * <p>
 * Each export writes a temporary file next to the target and moves it over the target, so readers never
 * see a partially written file. Exports never overlap. Export failures are logged and the next scheduled export
 * is still attempted.
 * Closing the exporter stops the schedule and writes the file one last time; the file is not written after that.
 */
public final class TextFileExporter implements MetricsExporter {

    private static final Logger logger = LogManager.getLogger(TextFileExporter.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path path;
    private final Path tempPath;
    private final int intervalSeconds;
    private final Supplier<ScheduledExecutorService> executorServiceFactory;

    private MetricRegistry registry;
    private ScheduledExecutorService executorService;
    private ScheduledFuture<?> scheduledExportFuture;
    private boolean closed;

    /**
     * Creates an exporter writing to the given file on a single daemon thread.
     *
     * @param path            the target file, must not be {@code null}
     * @param intervalSeconds the interval between two exports, must be positive
     * @throws IllegalArgumentException if the interval is not positive
     */
    public TextFileExporter(@NonNull Path path, int intervalSeconds) {
        this(path, intervalSeconds, TextFileExporter::newExecutorService);
    }

    TextFileExporter(
            @NonNull Path path,
            int intervalSeconds,
            @NonNull Supplier<ScheduledExecutorService> executorServiceFactory) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Export interval must be greater than 0 seconds");
        }
        this.intervalSeconds = intervalSeconds;
        this.executorServiceFactory =
                Objects.requireNonNull(executorServiceFactory, "executor service factory must not be null");
        this.tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
    }

    private static ScheduledExecutorService newExecutorService() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "textfile-metrics-exporter");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @return the file this exporter writes to
     */
    @NonNull
    public Path path() {
        return path;
    }

    /**
     * Binds the registry and schedules periodic export, starting immediately.
     *
     * @param registry the registry to export, must not be {@code null}
     * @throws IllegalStateException if the exporter is already bound or closed
     */
    @Override
    public synchronized void bind(@NonNull MetricRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        if (closed) {
            throw new IllegalStateException("Text file exporter is closed");
        }
        if (this.registry != null) {
            throw new IllegalStateException("Text file exporter is already bound to a registry");
        }
        this.registry = registry;

        logger.info("Scheduling text file export to {} with interval of {} seconds", path, intervalSeconds);
        executorService = executorServiceFactory.get();
        scheduledExportFuture =
                executorService.scheduleAtFixedRate(this::exportSafely, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Writes the current exposition text of the bound registry to the target file.
     *
     * @throws IOException           if writing or moving the file fails
     * @throws IllegalStateException if no registry is bound yet or the exporter is closed
     */
    public synchronized void export() throws IOException {
        if (closed) {
            throw new IllegalStateException("Text file exporter is closed");
        }
        writeFile();
    }

    private void writeFile() throws IOException {
        final MetricRegistry current = registry;
        if (current == null) {
            throw new IllegalStateException("Text file exporter is not bound to a registry");
        }

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(tempPath)) {
            current.flush(out);
        }
        try {
            Files.move(tempPath, path, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move is not supported for {}, replacing the file non-atomically", path);
            Files.move(tempPath, path, REPLACE_EXISTING);
        }
    }

    // no writes after the final export of close()
    private synchronized void exportSafely() {
        if (closed) {
            return;
        }
        try {
            writeFile();
        } catch (IOException | RuntimeException e) {
            logger.error("Error while exporting metrics to text file {}", path, e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        if (scheduledExportFuture != null) {
            scheduledExportFuture.cancel(false);
            scheduledExportFuture = null;
        }
        if (executorService != null) {
            executorService.shutdown();
            executorService = null;
        }
        if (registry != null) {
            logger.info("Writing final metrics export to {}", path);
            writeFile();
        }
    }
}
