package org.assemblerflow.qc.reads;

import org.assemblerflow.qc.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Known FASTQ quality encodings with the range of quality characters (as code points) each can produce.
 *
 * Declaration order is the order in which candidates are reported.
 */
public enum QualityEncoding {

    SANGER("Sanger", 33, 33, 74),
    ILLUMINA_1_8("Illumina-1.8", 33, 33, 74),
    SOLEXA("Solexa", 64, 59, 104),
    ILLUMINA_1_3("Illumina-1.3", 64, 64, 104),
    ILLUMINA_1_5("Illumina-1.5", 64, 66, 105);

    private final String displayName;
    private final int phredOffset;
    private final int lowestCodePoint;
    private final int highestCodePoint;

    QualityEncoding(final String displayName, final int phredOffset, final int lowestCodePoint, final int highestCodePoint) {
        this.displayName = displayName;
        this.phredOffset = phredOffset;
        this.lowestCodePoint = lowestCodePoint;
        this.highestCodePoint = highestCodePoint;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getPhredOffset() {
        return phredOffset;
    }

    public int getLowestCodePoint() {
        return lowestCodePoint;
    }

    public int getHighestCodePoint() {
        return highestCodePoint;
    }

    /**
     * @return true if every code point in {@code [min, max]} is a valid quality character of this encoding
     */
    public boolean covers(final int min, final int max) {
        Utils.validateArg(min <= max, () -> "invalid range [" + min + ", " + max + "]");
        return min >= lowestCodePoint && max <= highestCodePoint;
    }

    /**
     * All encodings whose range contains {@code [min, max]}, in declaration order.
     */
    public static List<QualityEncoding> candidatesFor(final int min, final int max) {
        final List<QualityEncoding> candidates = new ArrayList<>();
        for (final QualityEncoding encoding : values()) {
            if (encoding.covers(min, max)) {
                candidates.add(encoding);
            }
        }
        return candidates;
    }
}
