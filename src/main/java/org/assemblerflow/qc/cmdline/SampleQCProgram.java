package org.assemblerflow.qc.cmdline;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.report.QCStatus;
import org.assemblerflow.qc.utils.io.IOUtils;
import org.broadinstitute.barclay.argparser.Argument;

import java.io.File;
import java.nio.file.Path;

/**
 * Base class for tools that run one QC stage on one sample and leave a {@link QCStatus} token behind for the
 * orchestrating pipeline.
 *
 * Subclasses implement {@link #runSampleQC()}. Its status is written to the status file once it returns. If it throws,
 * {@code error} is written instead and the exception is re-thrown so that the process exits with a non-zero code.
 */
public abstract class SampleQCProgram extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.SAMPLE_ID_LONG_NAME,
            shortName = StandardArgumentDefinitions.SAMPLE_ID_SHORT_NAME,
            doc = "Sample identifier, used as the prefix of every output file")
    public String sampleId;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_SHORT_NAME,
            doc = "Directory the outputs are written to, created if missing", optional = true)
    public File outputDirectory = new File(".");

    @Argument(fullName = StandardArgumentDefinitions.STATUS_FILE_LONG_NAME,
            doc = "Status file. Defaults to the configured status file name inside the output directory", optional = true)
    public File statusFile = null;

    /**
     * Runs the QC stage, writing every output except the status file.
     * @return the status of the sample
     */
    protected abstract QCStatus runSampleQC();

    @Override
    protected final Object doWork() {
        final Path status = getStatusPath();
        try {
            IOUtils.createDirectories(outputDirectory.toPath());
            final QCStatus result = runSampleQC();
            result.write(status);
            logger.info(String.format("Sample %s finished with status %s", sampleId, result));
            return result;
        } catch (final RuntimeException e) {
            logger.error(String.format("Sample %s failed: %s", sampleId, e.getMessage()));
            try {
                QCStatus.ERROR.write(status);
            } catch (final UserException.CouldNotCreateOutputFile statusError) {
                e.addSuppressed(statusError);
            }
            throw e;
        }
    }

    public Path getStatusPath() {
        return statusFile != null ? statusFile.toPath() : outputDirectory.toPath().resolve(getQCConfig().status_file_name());
    }

    /**
     * @return {@code <output directory>/<sample id><suffix>}
     */
    protected Path getSampleOutputPath(final String suffix) {
        return outputDirectory.toPath().resolve(sampleId + suffix);
    }
}
