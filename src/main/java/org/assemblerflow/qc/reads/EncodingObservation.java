package org.assemblerflow.qc.reads;

import org.assemblerflow.qc.utils.Utils;

/**
 * Running minimum and maximum code point over all quality characters observed so far.
 *
 * Bounds only ever widen, so the candidate set computed from them can only shrink as more qualities are seen.
 * Empty quality strings leave the bounds untouched.
 */
public final class EncodingObservation {

    private int min = Integer.MAX_VALUE;
    private int max = Integer.MIN_VALUE;

    public void observe(final CharSequence qualities) {
        Utils.nonNull(qualities);
        for (int i = 0; i < qualities.length(); i++) {
            final char c = qualities.charAt(i);
            if (c < min) {
                min = c;
            }
            if (c > max) {
                max = c;
            }
        }
    }

    public boolean hasObservations() {
        return min <= max;
    }

    public int getMin() {
        Utils.validate(hasObservations(), "no quality characters observed");
        return min;
    }

    public int getMax() {
        Utils.validate(hasObservations(), "no quality characters observed");
        return max;
    }

    /**
     * The encodings compatible with the bounds observed so far; {@link EncodingCall#UNKNOWN} if nothing was observed.
     */
    public EncodingCall call() {
        if (!hasObservations()) {
            return EncodingCall.UNKNOWN;
        }
        return new EncodingCall(QualityEncoding.candidatesFor(min, max));
    }
}
