package org.assemblerflow.qc.reads;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.CompressionType;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Single streaming pass over one or more FASTQ files (typically a read pair) that infers the quality encoding,
 * estimates the sequencing coverage of the expected genome and records the longest read.
 *
 * <p>Within each file, line {@code i} (0-based) is a sequence line when {@code i % 4 == 1} and a quality line when
 * {@code i % 4 == 3}. Sequence line lengths are summed for the coverage numerator; quality lines widen the
 * {@link EncodingObservation}. Files are scanned in the given order as one logical stream.</p>
 *
 * <p>A file that ends prematurely, either as a truncated compressed stream or as an incomplete final record, aborts
 * the whole estimation and yields {@link IntegrityCoverageResult#corrupt(String)}; no partial values are returned.
 * A file that cannot be opened at all is a {@link UserException.CouldNotReadInputFile}.</p>
 */
public final class ReadIntegrityCoverageEstimator {

    private static final int LINES_PER_RECORD = 4;
    private static final int DECIMAL_PLACES = 2;
    private static final double BASES_PER_MEGABASE = 1e6;

    private final Logger logger;

    public ReadIntegrityCoverageEstimator() {
        this(LogManager.getLogger(ReadIntegrityCoverageEstimator.class));
    }

    public ReadIntegrityCoverageEstimator(final Logger logger) {
        this.logger = Utils.nonNull(logger, "logger");
    }

    /**
     * @param readFiles FASTQ files, plain or gzip/bzip2/zip compressed
     * @param genomeSizeMb expected genome size in megabases
     * @param minimumCoverage estimates at or above this value pass
     * @param skipEncoding when true quality lines are not inspected and the encoding is reported as unknown
     */
    public IntegrityCoverageResult estimate(final List<Path> readFiles, final double genomeSizeMb,
                                            final double minimumCoverage, final boolean skipEncoding) {
        Utils.nonEmpty(readFiles, "at least one read file is required");
        Utils.containsNoNull(readFiles, "read files must not be null");
        Utils.validateArg(genomeSizeMb > 0, () -> "genome size must be positive but was " + genomeSizeMb);
        Utils.validateArg(minimumCoverage >= 0, () -> "minimum coverage must not be negative but was " + minimumCoverage);

        for (final Path readFile : readFiles) {
            if (!Files.isReadable(readFile)) {
                throw new UserException.CouldNotReadInputFile(readFile, "file does not exist or is not readable");
            }
        }

        final ReadScan scan = new ReadScan(skipEncoding);
        try {
            for (final Path readFile : readFiles) {
                scanFile(readFile, scan);
            }
        } catch (final UserException.CorruptedReadFile e) {
            logger.warn("Aborting encoding and coverage estimation: " + e.getMessage());
            return IntegrityCoverageResult.corrupt(e.getMessage());
        }

        final double coverage = MathUtils.roundToNDecimalPlaces(scan.bases / (genomeSizeMb * BASES_PER_MEGABASE), DECIMAL_PLACES);
        final boolean passed = coverage >= minimumCoverage;
        final EncodingCall encoding = skipEncoding ? EncodingCall.UNKNOWN : scan.observation.call();

        if (!skipEncoding && encoding.isUnknown()) {
            logger.warn("Could not guess the quality encoding of " + readFiles);
        }
        logger.info(String.format("Scanned %d reads (%d bases): encoding %s, estimated coverage %s (%s minimum %s), max read length %d",
                scan.reads, scan.bases, encoding.getEncodingText(), coverage, passed ? "meets" : "below",
                minimumCoverage, scan.maxReadLength));

        return IntegrityCoverageResult.completed(encoding, coverage, passed, scan.maxReadLength, scan.bases);
    }

    private void scanFile(final Path readFile, final ReadScan scan) {
        final CompressionType compression = IOUtils.detectCompression(readFile);
        logger.debug("Reading " + readFile + " as " + compression);

        long lineIndex = 0;
        int sequenceLength = 0;
        try (final BufferedReader reader = IOUtils.makeReader(readFile, compression)) {
            String line;
            while ((line = reader.readLine()) != null) {
                final int position = (int) (lineIndex % LINES_PER_RECORD);
                if (position == 1) {
                    sequenceLength = line.trim().length();
                    scan.addSequence(sequenceLength);
                } else if (position == 3) {
                    final String qualities = line.trim();
                    if (qualities.length() < sequenceLength) {
                        throw new UserException.CorruptedReadFile(readFile.toString(),
                                String.format("record ending at line %d has %d quality values for %d bases", lineIndex + 1, qualities.length(), sequenceLength));
                    }
                    scan.addQualities(qualities);
                }
                lineIndex++;
            }
        } catch (final IOException e) {
            throw new UserException.CorruptedReadFile(readFile.toString(), "unexpected end of stream", e);
        }

        if (lineIndex % LINES_PER_RECORD != 0) {
            throw new UserException.CorruptedReadFile(readFile.toString(),
                    String.format("%d lines is not a whole number of %d-line records", lineIndex, LINES_PER_RECORD));
        }
    }

    private static final class ReadScan {
        private final boolean skipEncoding;
        private final EncodingObservation observation = new EncodingObservation();
        private long bases = 0;
        private long reads = 0;
        private int maxReadLength = 0;

        ReadScan(final boolean skipEncoding) {
            this.skipEncoding = skipEncoding;
        }

        void addSequence(final int length) {
            reads++;
            bases += length;
            maxReadLength = Math.max(maxReadLength, length);
        }

        void addQualities(final String qualities) {
            if (!skipEncoding) {
                observation.observe(qualities);
            }
        }
    }
}
