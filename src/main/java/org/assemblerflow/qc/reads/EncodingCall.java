package org.assemblerflow.qc.reads;

import org.assemblerflow.qc.utils.Utils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The outcome of encoding inference: zero (unknown), one (resolved) or several (ambiguous) candidate encodings.
 */
public final class EncodingCall {

    public static final EncodingCall UNKNOWN = new EncodingCall(Collections.emptyList());

    /**
     * Text written in place of the encoding and phred offset when no candidate exists.
     */
    public static final String UNKNOWN_TEXT = "None";

    private final List<QualityEncoding> candidates;

    public EncodingCall(final List<QualityEncoding> candidates) {
        Utils.containsNoNull(candidates, "candidates");
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    public List<QualityEncoding> getCandidates() {
        return candidates;
    }

    public boolean isUnknown() {
        return candidates.isEmpty();
    }

    public boolean isAmbiguous() {
        return candidates.size() > 1;
    }

    /**
     * Distinct phred offsets of the candidates, in candidate order.
     */
    public Set<Integer> getPhredOffsets() {
        return candidates.stream()
                .map(QualityEncoding::getPhredOffset)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * e.g. {@code "Sanger,Illumina-1.8"}, {@code "Illumina-1.5"} or {@code "None"}
     */
    public String getEncodingText() {
        if (isUnknown()) {
            return UNKNOWN_TEXT;
        }
        return candidates.stream().map(QualityEncoding::getDisplayName).collect(Collectors.joining(","));
    }

    /**
     * e.g. {@code "33"}, {@code "33,64"} or {@code "None"}
     */
    public String getPhredText() {
        if (isUnknown()) {
            return UNKNOWN_TEXT;
        }
        return getPhredOffsets().stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return candidates.equals(((EncodingCall) o).candidates);
    }

    @Override
    public int hashCode() {
        return candidates.hashCode();
    }

    @Override
    public String toString() {
        return getEncodingText();
    }
}
