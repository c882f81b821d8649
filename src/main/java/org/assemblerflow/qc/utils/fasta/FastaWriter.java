package org.assemblerflow.qc.utils.fasta;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@link SequenceRecord}s as single-line FASTA, optionally prefixing every header.
 */
public final class FastaWriter {

    private FastaWriter(){}

    public static void write(final Path output, final Iterable<SequenceRecord> records) {
        write(output, records, "");
    }

    /**
     * @param headerPrefix text inserted between '>' and the record identifier, e.g. {@code "sample_"}
     */
    public static void write(final Path output, final Iterable<SequenceRecord> records, final String headerPrefix) {
        Utils.nonNull(output);
        Utils.nonNull(records);
        Utils.nonNull(headerPrefix);
        try (final BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            for (final SequenceRecord record : records) {
                writer.write(FastaRecordParser.HEADER_MARKER);
                writer.write(headerPrefix);
                writer.write(record.getId());
                writer.write('\n');
                writer.write(record.getSequence());
                writer.write('\n');
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output, "could not write FASTA records", e);
        }
    }
}
