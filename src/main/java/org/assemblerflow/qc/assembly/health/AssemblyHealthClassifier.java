package org.assemblerflow.qc.assembly.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.assemblerflow.qc.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies a filtered assembly against the expected genome size G (in Mb).
 *
 * <ul>
 *     <li>length below {@code G * 1e6 * minLengthFraction}: fail, "assembly too small"</li>
 *     <li>length above {@code G * 1e6 * maxLengthFraction}: warning {@link HealthWarning#ASSEMBLY_LARGER_THAN_EXPECTED}</li>
 *     <li>contig count above {@code maxContigsPer1_5Mb * G / 1.5}: warning {@link HealthWarning#EXCESSIVE_CONTIG_COUNT}</li>
 * </ul>
 *
 * All three checks are always evaluated. The classifier keeps no state between calls.
 */
public final class AssemblyHealthClassifier {

    public static final double DEFAULT_MIN_LENGTH_FRACTION = 0.8;
    public static final double DEFAULT_MAX_LENGTH_FRACTION = 1.5;

    private static final double BASES_PER_MEGABASE = 1e6;
    private static final double CONTIG_COUNT_REFERENCE_MB = 1.5;

    private final double minLengthFraction;
    private final double maxLengthFraction;
    private final Logger logger;

    public AssemblyHealthClassifier() {
        this(DEFAULT_MIN_LENGTH_FRACTION, DEFAULT_MAX_LENGTH_FRACTION);
    }

    public AssemblyHealthClassifier(final double minLengthFraction, final double maxLengthFraction) {
        this(minLengthFraction, maxLengthFraction, LogManager.getLogger(AssemblyHealthClassifier.class));
    }

    public AssemblyHealthClassifier(final double minLengthFraction, final double maxLengthFraction, final Logger logger) {
        Utils.validateArg(minLengthFraction > 0, "minimum length fraction must be positive");
        Utils.validateArg(maxLengthFraction >= minLengthFraction, "maximum length fraction must not be below the minimum");
        this.minLengthFraction = minLengthFraction;
        this.maxLengthFraction = maxLengthFraction;
        this.logger = Utils.nonNull(logger, "logger");
    }

    /**
     * Smallest acceptable assembly length (T80 with the default fraction).
     */
    public double minimumLength(final double genomeSizeMb) {
        return genomeSizeMb * BASES_PER_MEGABASE * minLengthFraction;
    }

    /**
     * Largest expected assembly length (T150 with the default fraction).
     */
    public double maximumLength(final double genomeSizeMb) {
        return genomeSizeMb * BASES_PER_MEGABASE * maxLengthFraction;
    }

    public static double contigCountThreshold(final int maxContigsPer1_5Mb, final double genomeSizeMb) {
        return maxContigsPer1_5Mb * genomeSizeMb / CONTIG_COUNT_REFERENCE_MB;
    }

    /**
     * @return true if {@code filteredLength} is below the minimum acceptable length
     */
    public boolean isTooSmall(final long filteredLength, final double genomeSizeMb) {
        return filteredLength < minimumLength(genomeSizeMb);
    }

    public HealthVerdict classify(final long filteredLength, final int filteredContigCount, final double genomeSizeMb,
                                  final int maxContigsPer1_5Mb) {
        Utils.validateArg(filteredLength >= 0, "filtered length must not be negative");
        Utils.validateArg(filteredContigCount >= 0, "filtered contig count must not be negative");
        Utils.validateArg(genomeSizeMb > 0, () -> "genome size must be positive but was " + genomeSizeMb);
        Utils.validateArg(maxContigsPer1_5Mb >= 0, "maximum contig count must not be negative");

        final List<HealthWarning> warnings = new ArrayList<>();
        final boolean tooSmall = isTooSmall(filteredLength, genomeSizeMb);
        if (tooSmall) {
            logger.warn(String.format("Assembly length %d is below %.0f, %.0f%% of the expected genome size",
                    filteredLength, minimumLength(genomeSizeMb), minLengthFraction * 100));
        }

        if (filteredLength > maximumLength(genomeSizeMb)) {
            logger.warn(String.format("Assembly length %d is above %.0f, %.0f%% of the expected genome size",
                    filteredLength, maximumLength(genomeSizeMb), maxLengthFraction * 100));
            warnings.add(HealthWarning.ASSEMBLY_LARGER_THAN_EXPECTED);
        }

        final double contigThreshold = contigCountThreshold(maxContigsPer1_5Mb, genomeSizeMb);
        if (filteredContigCount > contigThreshold) {
            logger.warn(String.format("The number of contigs (%d) exceeds the threshold of %d contigs per 1.5Mb (%s)",
                    filteredContigCount, maxContigsPer1_5Mb, contigThreshold));
            warnings.add(HealthWarning.EXCESSIVE_CONTIG_COUNT);
        }

        final HealthVerdict verdict = tooSmall ? HealthVerdict.fail(HealthVerdict.ASSEMBLY_TOO_SMALL, warnings) : HealthVerdict.pass(warnings);
        logger.info("Assembly health: " + verdict);
        return verdict;
    }
}
