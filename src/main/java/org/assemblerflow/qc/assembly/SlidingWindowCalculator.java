package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.exceptions.QCException;
import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.assemblerflow.qc.utils.fasta.SequenceStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds GC and coverage {@link WindowTrack}s over the concatenation of all contigs in input order.
 *
 * For a window size W the windows start at 0, W, 2W, ... and the last one may be shorter. Each window is labelled
 * with the {@code NODE_<n>} id of the contig containing its first position. The boundary map is derived per call from
 * the data being windowed, so tracks for different window sizes never share state.
 */
public final class SlidingWindowCalculator {

    private static final int DECIMAL_PLACES = 2;

    private final int windowSize;

    public SlidingWindowCalculator(final int windowSize) {
        Utils.validateArg(windowSize > 0, () -> "window size must be positive but was " + windowSize);
        this.windowSize = windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * GC proportion per window, counting both cases of G and C, rounded to two decimals.
     */
    public WindowTrack gcTrack(final SequenceStore records) {
        Utils.nonNull(records);
        final LinkedHashMap<String, Integer> lengths = new LinkedHashMap<>();
        final StringBuilder concatenated = new StringBuilder();
        for (final SequenceRecord record : records) {
            lengths.put(record.getId(), record.length());
            concatenated.append(record.getSequence());
        }
        final ContigBoundaryMap boundaries = ContigBoundaryMap.fromLengths(lengths);

        final List<WindowTrack.Window> windows = new ArrayList<>();
        for (int start = 0; start < concatenated.length(); start += windowSize) {
            final String slice = concatenated.substring(start, Math.min(start + windowSize, concatenated.length()));
            final double gc = MathUtils.roundToNDecimalPlaces(AssemblyStatisticsCalculator.gcProportionIgnoreCase(slice), DECIMAL_PLACES);
            windows.add(new WindowTrack.Window(gc, labelAt(boundaries, start), start));
        }
        return new WindowTrack(windowSize, windows, boundaries);
    }

    /**
     * Mean per-base depth per window, rounded to two decimals.
     *
     * @throws org.assemblerflow.qc.exceptions.UserException.MissingContigCoverage if {@code depths} has no rows for
     * one of the records
     */
    public WindowTrack coverageTrack(final SequenceStore records, final PerBaseDepthTable depths) {
        Utils.nonNull(records);
        Utils.nonNull(depths);
        final LinkedHashMap<String, Integer> lengths = new LinkedHashMap<>();
        final List<Integer> concatenated = new ArrayList<>();
        for (final SequenceRecord record : records) {
            final List<Integer> contigDepths = depths.getDepths(record.getId());
            lengths.put(record.getId(), contigDepths.size());
            concatenated.addAll(contigDepths);
        }
        final ContigBoundaryMap boundaries = ContigBoundaryMap.fromLengths(lengths);

        final List<WindowTrack.Window> windows = new ArrayList<>();
        for (int start = 0; start < concatenated.size(); start += windowSize) {
            final int end = Math.min(start + windowSize, concatenated.size());
            final double mean = MathUtils.roundToNDecimalPlaces(MathUtils.mean(concatenated, start, end), DECIMAL_PLACES);
            windows.add(new WindowTrack.Window(mean, labelAt(boundaries, start), start));
        }
        return new WindowTrack(windowSize, windows, boundaries);
    }

    private static String labelAt(final ContigBoundaryMap boundaries, final long position) {
        return boundaries.findContaining(position)
                .orElseThrow(() -> new QCException.ShouldNeverReachHereException("no contig contains position " + position))
                .getContigId();
    }
}
