package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.MathUtils;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.fasta.SequenceRecord;
import org.assemblerflow.qc.utils.fasta.SequenceStore;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Whole-assembly statistics over a {@link SequenceStore}.
 *
 * Two GC conventions coexist on purpose:
 * <ul>
 *     <li>{@link #gcProportion(String)} counts only upper case 'G' and 'C'. It feeds {@link AssemblySummary#AVG_GC}
 *     and the per-contig GC used for filtering.</li>
 *     <li>{@link #gcProportionIgnoreCase(String)} counts both cases. It feeds the sliding-window GC track.</li>
 * </ul>
 * A soft-masked (lower case) assembly therefore has a summary GC of 0 but a meaningful GC track.
 */
public final class AssemblyStatisticsCalculator {

    private AssemblyStatisticsCalculator(){}

    /**
     * @throws UserException.BadInput if {@code records} is empty, since the averages are undefined
     */
    public static AssemblySummary summarize(final SequenceStore records) {
        Utils.nonNull(records);
        if (records.isEmpty()) {
            throw new UserException.BadInput("cannot summarize an assembly with no contigs");
        }

        final int[] lengths = new int[records.size()];
        double gcSum = 0;
        long missing = 0;
        int i = 0;
        for (final SequenceRecord record : records) {
            lengths[i++] = record.length();
            gcSum += gcProportion(record.getSequence());
            missing += countMissing(record.getSequence());
        }

        final long totalLength = MathUtils.sum(lengths);
        final long ncontigs = records.size();
        return new AssemblySummary(
                ncontigs,
                totalLength / (double) ncontigs,
                n50(lengths),
                totalLength,
                gcSum / ncontigs,
                missing);
    }

    /**
     * Contig lengths in input order.
     */
    public static List<Integer> contigLengths(final SequenceStore records) {
        Utils.nonNull(records);
        return records.getRecords().stream().map(SequenceRecord::length).collect(Collectors.toList());
    }

    /**
     * Sorts {@code lengths} longest first and returns the length at which the running sum first reaches
     * half of the total. The result is always one of the input lengths.
     */
    public static int n50(final int[] lengths) {
        Utils.nonNull(lengths);
        Utils.validateArg(lengths.length > 0, "N50 is undefined for an empty set of lengths");

        final int[] sorted = lengths.clone();
        Arrays.sort(sorted);
        Utils.validateArg(sorted[0] >= 0, "lengths must not be negative");
        final long total = MathUtils.sum(sorted);

        long cumulative = 0;
        for (int i = sorted.length - 1; i >= 0; i--) {
            cumulative += sorted[i];
            if (2 * cumulative >= total) {
                return sorted[i];
            }
        }
        // the loop always returns once the full sum is reached
        throw new IllegalStateException("N50 not reached for total length " + total);
    }

    /**
     * Proportion of upper case 'G' and 'C' characters. An empty sequence has proportion 0.
     */
    public static double gcProportion(final String sequence) {
        return proportion(sequence, countChars(sequence, 'G', 'C'));
    }

    /**
     * Proportion of 'G', 'C', 'g' and 'c' characters. An empty sequence has proportion 0.
     */
    public static double gcProportionIgnoreCase(final String sequence) {
        return proportion(sequence, countChars(sequence, 'G', 'C', 'g', 'c'));
    }

    /**
     * Proportion of upper case 'A' and 'T' characters.
     */
    public static double atProportion(final String sequence) {
        return proportion(sequence, countChars(sequence, 'A', 'T'));
    }

    /**
     * Proportion of upper case 'N' characters.
     */
    public static double missingProportion(final String sequence) {
        return proportion(sequence, countMissing(sequence));
    }

    /**
     * Number of upper case 'N' characters.
     */
    public static long countMissing(final String sequence) {
        return countChars(sequence, 'N');
    }

    private static double proportion(final String sequence, final long count) {
        return sequence.isEmpty() ? 0.0 : count / (double) sequence.length();
    }

    private static long countChars(final String sequence, final char... targets) {
        Utils.nonNull(sequence);
        long count = 0;
        for (int i = 0; i < sequence.length(); i++) {
            final char c = sequence.charAt(i);
            for (final char target : targets) {
                if (c == target) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }
}
