package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the structured fields assemblers embed in contig headers, e.g.
 * {@code NODE_12_length_5321_cov_24.65} or {@code sampleA_NODE_12_length_5321_cov_24.65}.
 *
 * Each extraction fails with {@link UserException.MalformedContigHeader} when its token is absent; plain
 * FASTA parsing never requires these tokens.
 */
public final class ContigHeaderParser {

    private static final Pattern NODE_ID_PATTERN = Pattern.compile("(?:^|_)NODE_(\\d+)_");
    private static final Pattern LENGTH_PATTERN = Pattern.compile("length_(\\d+)_");

    private ContigHeaderParser(){}

    /**
     * @return the numeric id following {@code NODE_}
     */
    public static String nodeId(final String header) {
        Utils.nonNull(header);
        final Matcher m = NODE_ID_PATTERN.matcher(header);
        if (!m.find()) {
            throw new UserException.MalformedContigHeader(header, "a NODE_<n>_ token");
        }
        return m.group(1);
    }

    /**
     * @return the value of the {@code length_<n>_} token
     */
    public static int length(final String header) {
        Utils.nonNull(header);
        final Matcher m = LENGTH_PATTERN.matcher(header);
        if (!m.find()) {
            throw new UserException.MalformedContigHeader(header, "a length_<n>_ token");
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (final NumberFormatException e) {
            throw new UserException.MalformedContigHeader(header, "a length_<n>_ token with an integer length", e);
        }
    }

    /**
     * @return the k-mer coverage, the last {@code _}-separated token of the header
     */
    public static double kmerCoverage(final String header) {
        Utils.nonNull(header);
        final int lastSeparator = header.lastIndexOf('_');
        if (lastSeparator < 0 || lastSeparator == header.length() - 1) {
            throw new UserException.MalformedContigHeader(header, "a trailing _<coverage> token");
        }
        try {
            return Double.parseDouble(header.substring(lastSeparator + 1));
        } catch (final NumberFormatException e) {
            throw new UserException.MalformedContigHeader(header, "a numeric trailing _<coverage> token", e);
        }
    }
}
