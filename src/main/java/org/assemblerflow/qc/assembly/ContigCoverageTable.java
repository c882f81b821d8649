package org.assemblerflow.qc.assembly;

import org.apache.commons.lang3.StringUtils;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Per-contig alignment coverage: whitespace-delimited rows of {@code contig coverage}. The contig length is taken
 * from the {@code length_<n>_} token of the contig name, so names must carry it.
 */
public final class ContigCoverageTable {

    private final String source;
    private final Map<String, Double> coverageByContig;
    private final Map<String, Integer> lengthByContig;
    private final double totalCoverage;
    private final long totalLength;

    private ContigCoverageTable(final String source, final Map<String, Double> coverageByContig, final Map<String, Integer> lengthByContig) {
        this.source = source;
        this.coverageByContig = Collections.unmodifiableMap(coverageByContig);
        this.lengthByContig = Collections.unmodifiableMap(lengthByContig);
        this.totalCoverage = coverageByContig.values().stream().mapToDouble(Double::doubleValue).sum();
        this.totalLength = lengthByContig.values().stream().mapToLong(Integer::longValue).sum();
    }

    public static ContigCoverageTable parse(final Path path) {
        Utils.nonNull(path);
        try (final BufferedReader reader = IOUtils.makeReaderMaybeCompressed(path)) {
            return parse(reader, path.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    public static ContigCoverageTable parse(final BufferedReader reader, final String source) throws IOException {
        Utils.nonNull(reader);
        final Map<String, Double> coverage = new LinkedHashMap<>();
        final Map<String, Integer> lengths = new LinkedHashMap<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (StringUtils.isBlank(line)) {
                continue;
            }
            final String[] fields = StringUtils.split(line);
            if (fields.length != 2) {
                throw new UserException.MalformedFile(source,
                        String.format("line %d has %d fields, expected contig and coverage", lineNumber, fields.length));
            }
            final String contig = fields[0];
            if (coverage.containsKey(contig)) {
                throw new UserException.MalformedFile(source, String.format("line %d repeats contig %s", lineNumber, contig));
            }
            try {
                coverage.put(contig, Double.parseDouble(fields[1]));
            } catch (final NumberFormatException e) {
                throw new UserException.MalformedFile(source,
                        String.format("line %d has a non-numeric coverage: %s", lineNumber, line), e);
            }
            lengths.put(contig, ContigHeaderParser.length(contig));
        }
        return new ContigCoverageTable(source, coverage, lengths);
    }

    public boolean contains(final String contig) {
        return coverageByContig.containsKey(contig);
    }

    public Set<String> getContigs() {
        return coverageByContig.keySet();
    }

    /**
     * @throws UserException.MissingContigCoverage if the contig has no row
     */
    public double getCoverage(final String contig) {
        Utils.nonNull(contig);
        final Double coverage = coverageByContig.get(contig);
        if (coverage == null) {
            throw new UserException.MissingContigCoverage(contig, source);
        }
        return coverage;
    }

    public int getLength(final String contig) {
        Utils.nonNull(contig);
        final Integer length = lengthByContig.get(contig);
        if (length == null) {
            throw new UserException.MissingContigCoverage(contig, source);
        }
        return length;
    }

    /**
     * Sum of the coverage column.
     */
    public double getTotalCoverage() {
        return totalCoverage;
    }

    /**
     * Sum of the contig lengths named in the table.
     */
    public long getTotalLength() {
        return totalLength;
    }

    public int size() {
        return coverageByContig.size();
    }
}
