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
 * Per-base alignment depth, as written by {@code samtools depth}: whitespace-delimited rows of
 * {@code contig position depth}.
 *
 * Depths are kept per contig in file order; rows are not re-sorted by position.
 */
public final class PerBaseDepthTable {

    private final String source;
    private final Map<String, List<Integer>> depthsByContig;

    private PerBaseDepthTable(final String source, final Map<String, List<Integer>> depthsByContig) {
        this.source = source;
        this.depthsByContig = depthsByContig;
    }

    public static PerBaseDepthTable parse(final Path path) {
        Utils.nonNull(path);
        try (final BufferedReader reader = IOUtils.makeReaderMaybeCompressed(path)) {
            return parse(reader, path.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Parses depth rows from {@code reader}. Blank lines are skipped. The reader is not closed.
     * @param source name of the input used in error messages
     */
    public static PerBaseDepthTable parse(final BufferedReader reader, final String source) throws IOException {
        Utils.nonNull(reader);
        final Map<String, List<Integer>> depths = new LinkedHashMap<>();
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (StringUtils.isBlank(line)) {
                continue;
            }
            final String[] fields = StringUtils.split(line);
            if (fields.length < 3) {
                throw new UserException.MalformedFile(source,
                        String.format("line %d has %d fields, expected contig, position and depth", lineNumber, fields.length));
            }
            try {
                Integer.parseInt(fields[1]);
                depths.computeIfAbsent(fields[0], k -> new ArrayList<>()).add(Integer.parseInt(fields[2]));
            } catch (final NumberFormatException e) {
                throw new UserException.MalformedFile(source,
                        String.format("line %d has a non-integer position or depth: %s", lineNumber, line), e);
            }
        }
        return new PerBaseDepthTable(source, depths);
    }

    public boolean contains(final String contig) {
        return lookupKey(contig) != null;
    }

    public Set<String> getContigs() {
        return Collections.unmodifiableSet(depthsByContig.keySet());
    }

    /**
     * Depth values of {@code contig} in file order. A contig is matched by its full header first and then by the
     * first whitespace-separated word of the header, which is how aligners name references.
     *
     * @throws UserException.MissingContigCoverage if the table has no rows for the contig
     */
    public List<Integer> getDepths(final String contig) {
        Utils.nonNull(contig);
        final String key = lookupKey(contig);
        if (key == null) {
            throw new UserException.MissingContigCoverage(contig, source);
        }
        return Collections.unmodifiableList(depthsByContig.get(key));
    }

    private String lookupKey(final String contig) {
        if (depthsByContig.containsKey(contig)) {
            return contig;
        }
        final String firstWord = StringUtils.substringBefore(contig.trim(), " ");
        return depthsByContig.containsKey(firstWord) ? firstWord : null;
    }
}
