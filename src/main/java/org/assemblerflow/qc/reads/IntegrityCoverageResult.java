package org.assemblerflow.qc.reads;

import org.assemblerflow.qc.utils.Utils;

/**
 * Result of {@link ReadIntegrityCoverageEstimator#estimate}: the encoding call, the coverage estimate with its
 * pass/fail outcome and the maximum read length, or nothing but the corruption flag.
 *
 * The {@code get*Text} methods render the five plain-text output channels. For a corrupted input every channel is
 * {@link #CORRUPT}.
 */
public final class IntegrityCoverageResult {

    public static final String CORRUPT = "corrupt";

    /**
     * Written to the coverage channel instead of the estimate when it is below the minimum.
     */
    public static final String COVERAGE_FAIL = "fail";

    private final boolean corrupt;
    private final String corruptionReason;
    private final EncodingCall encoding;
    private final double coverage;
    private final boolean coveragePassed;
    private final int maxReadLength;
    private final long totalBases;

    private IntegrityCoverageResult(final boolean corrupt, final String corruptionReason, final EncodingCall encoding,
                                    final double coverage, final boolean coveragePassed, final int maxReadLength,
                                    final long totalBases) {
        this.corrupt = corrupt;
        this.corruptionReason = corruptionReason;
        this.encoding = encoding;
        this.coverage = coverage;
        this.coveragePassed = coveragePassed;
        this.maxReadLength = maxReadLength;
        this.totalBases = totalBases;
    }

    public static IntegrityCoverageResult completed(final EncodingCall encoding, final double coverage, final boolean coveragePassed,
                                                    final int maxReadLength, final long totalBases) {
        Utils.nonNull(encoding);
        return new IntegrityCoverageResult(false, null, encoding, coverage, coveragePassed, maxReadLength, totalBases);
    }

    public static IntegrityCoverageResult corrupt(final String reason) {
        return new IntegrityCoverageResult(true, Utils.nonNull(reason), EncodingCall.UNKNOWN, Double.NaN, false, 0, 0);
    }

    public boolean isCorrupt() {
        return corrupt;
    }

    public String getCorruptionReason() {
        Utils.validate(corrupt, "result is not corrupt");
        return corruptionReason;
    }

    public EncodingCall getEncoding() {
        requireComplete();
        return encoding;
    }

    /**
     * Total sequenced bases divided by the genome size, rounded to two decimals.
     */
    public double getCoverage() {
        requireComplete();
        return coverage;
    }

    public boolean isCoveragePassed() {
        return !corrupt && coveragePassed;
    }

    public int getMaxReadLength() {
        requireComplete();
        return maxReadLength;
    }

    public long getTotalBases() {
        requireComplete();
        return totalBases;
    }

    private void requireComplete() {
        Utils.validate(!corrupt, "no estimates are available for a corrupted input");
    }

    public String getEncodingText() {
        return corrupt ? CORRUPT : encoding.getEncodingText();
    }

    public String getPhredText() {
        return corrupt ? CORRUPT : encoding.getPhredText();
    }

    public String getCoverageText() {
        if (corrupt) {
            return CORRUPT;
        }
        return coveragePassed ? Double.toString(coverage) : COVERAGE_FAIL;
    }

    /**
     * {@code <sample>,<coverage>,PASS} or {@code <sample>,<coverage>,FAIL}
     */
    public String getReportText(final String sampleId) {
        Utils.nonNull(sampleId);
        if (corrupt) {
            return CORRUPT;
        }
        return String.join(",", sampleId, Double.toString(coverage), coveragePassed ? "PASS" : "FAIL");
    }

    public String getMaxReadLengthText() {
        return corrupt ? CORRUPT : Integer.toString(maxReadLength);
    }

    @Override
    public String toString() {
        if (corrupt) {
            return "IntegrityCoverageResult(corrupt: " + corruptionReason + ")";
        }
        return String.format("IntegrityCoverageResult(encoding=%s, coverage=%s, passed=%s, maxReadLength=%d)",
                encoding, coverage, coveragePassed, maxReadLength);
    }
}
