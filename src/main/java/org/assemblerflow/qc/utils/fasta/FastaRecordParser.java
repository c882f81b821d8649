package org.assemblerflow.qc.utils.fasta;

import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses FASTA text into a {@link SequenceStore}.
 *
 * <ul>
 *     <li>Lines starting with {@link #HEADER_MARKER} open a new record; the rest of the line, trimmed, is its identifier.</li>
 *     <li>Every other non-blank line is trimmed and appended to the sequence of the current record.</li>
 *     <li>Blank lines are skipped.</li>
 *     <li>A sequence line before the first header is a {@link UserException.MalformedFile}.</li>
 * </ul>
 */
public final class FastaRecordParser {

    public static final char HEADER_MARKER = '>';

    private FastaRecordParser(){}

    /**
     * Parses the FASTA file at {@code path}. Compressed files are detected from their magic bytes.
     */
    public static SequenceStore parse(final Path path) {
        Utils.nonNull(path);
        try (final BufferedReader reader = IOUtils.makeReaderMaybeCompressed(path)) {
            return parse(reader, path.toString());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Parses FASTA text from {@code reader}. The reader is not closed.
     * @param source name of the input used in error messages
     */
    public static SequenceStore parse(final BufferedReader reader, final String source) throws IOException {
        Utils.nonNull(reader);

        final List<SequenceRecord> records = new ArrayList<>();
        String currentId = null;
        StringBuilder currentSequence = null;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.charAt(0) == HEADER_MARKER) {
                if (currentId != null) {
                    records.add(new SequenceRecord(currentId, currentSequence.toString()));
                }
                currentId = trimmed.substring(1).trim();
                currentSequence = new StringBuilder();
            } else {
                if (currentId == null) {
                    throw new UserException.MalformedFile(source,
                            String.format("sequence data at line %d but no current record (missing '%c' header)", lineNumber, HEADER_MARKER));
                }
                currentSequence.append(trimmed);
            }
        }
        if (currentId != null) {
            records.add(new SequenceRecord(currentId, currentSequence.toString()));
        }

        return new SequenceStore(records);
    }
}
