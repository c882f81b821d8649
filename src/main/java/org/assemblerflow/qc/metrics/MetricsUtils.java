package org.assemblerflow.qc.metrics;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.metrics.MetricsFile;
import org.assemblerflow.qc.exceptions.UserException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility methods for dealing with {@link MetricsFile} and related classes.
 */
public final class MetricsUtils {

    private MetricsUtils(){} //don't instantiate this utility class

    /**
     * Write a {@link MetricsFile} to the given path.
     * @param metricsFile a {@link MetricsFile} object to write to disk
     * @param metricsOutputPath the path to write the metrics to
     */
    public static void saveMetrics(final MetricsFile<?, ?> metricsFile, final Path metricsOutputPath) {
        try (final Writer out = new BufferedWriter(Files.newBufferedWriter(metricsOutputPath, StandardCharsets.UTF_8))) {
            metricsFile.write(out);
        } catch (IOException | SAMException e) {
            throw new UserException.CouldNotCreateOutputFile("Could not write metrics to file: " + metricsOutputPath, e);
        }
    }
}
