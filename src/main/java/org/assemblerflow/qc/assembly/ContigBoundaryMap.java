package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.utils.Utils;

import java.util.*;

/**
 * Absolute half-open ranges {@code [start, end)} of each contig within the concatenation of all contigs, in
 * input order.
 *
 * Ranges are built by accumulating lengths, so they are contiguous, sorted by start and never overlap, which lets
 * {@link #findContaining(long)} binary search the starts. Zero-length contigs own an empty range and are never found.
 */
public final class ContigBoundaryMap {

    public static final class Boundary {
        private final String header;
        private final String contigId;
        private final long start;
        private final long end;

        Boundary(final String header, final String contigId, final long start, final long end) {
            this.header = header;
            this.contigId = contigId;
            this.start = start;
            this.end = end;
        }

        public String getHeader() {
            return header;
        }

        /**
         * The numeric {@code NODE_<n>} id taken from the header.
         */
        public String getContigId() {
            return contigId;
        }

        public long getStart() {
            return start;
        }

        public long getEnd() {
            return end;
        }

        public boolean contains(final long position) {
            return position >= start && position < end;
        }

        @Override
        public String toString() {
            return contigId + ":[" + start + "," + end + ")";
        }
    }

    private final List<Boundary> boundaries;

    private ContigBoundaryMap(final List<Boundary> boundaries) {
        this.boundaries = Collections.unmodifiableList(boundaries);
    }

    /**
     * @param lengthsByHeader data length of each contig, keyed by header, in concatenation order
     * @throws org.assemblerflow.qc.exceptions.UserException.MalformedContigHeader if a header has no {@code NODE_<n>} id
     */
    public static ContigBoundaryMap fromLengths(final LinkedHashMap<String, Integer> lengthsByHeader) {
        Utils.nonNull(lengthsByHeader);
        final List<Boundary> boundaries = new ArrayList<>(lengthsByHeader.size());
        long offset = 0;
        for (final Map.Entry<String, Integer> entry : lengthsByHeader.entrySet()) {
            Utils.validateArg(entry.getValue() >= 0, () -> "negative length for " + entry.getKey());
            final long end = offset + entry.getValue();
            boundaries.add(new Boundary(entry.getKey(), ContigHeaderParser.nodeId(entry.getKey()), offset, end));
            offset = end;
        }
        return new ContigBoundaryMap(boundaries);
    }

    public List<Boundary> getBoundaries() {
        return boundaries;
    }

    /**
     * Total length covered by the map.
     */
    public long getTotalLength() {
        return boundaries.isEmpty() ? 0 : boundaries.get(boundaries.size() - 1).getEnd();
    }

    /**
     * @return the contig whose range contains {@code position}, or empty if the position is negative or at or past
     * {@link #getTotalLength()}
     */
    public Optional<Boundary> findContaining(final long position) {
        // last boundary starting at or before position; an empty range there is followed by one with the same start
        int low = 0;
        int high = boundaries.size() - 1;
        int candidate = -1;
        while (low <= high) {
            final int mid = (low + high) >>> 1;
            if (boundaries.get(mid).getStart() <= position) {
                candidate = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        if (candidate < 0 || !boundaries.get(candidate).contains(position)) {
            return Optional.empty();
        }
        return Optional.of(boundaries.get(candidate));
    }
}
