package org.assemblerflow.qc.testutils;

import htsjdk.samtools.fastq.BasicFastqWriter;
import htsjdk.samtools.fastq.FastqRecord;
import org.assemblerflow.qc.utils.Utils;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Utilities for writing synthetic FASTQ files, plain or gzip compressed, and for damaging them.
 */
public final class FastqTestUtils {

    private static final String BASES = "ACGT";

    private FastqTestUtils() {}

    /**
     * {@code count} reads of {@code length} bases, every quality value set to {@code quality}.
     */
    public static List<FastqRecord> makeReads(final int count, final int length, final char quality) {
        final List<FastqRecord> reads = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final StringBuilder bases = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                bases.append(BASES.charAt((i + j) % BASES.length()));
            }
            reads.add(new FastqRecord("read" + i, bases.toString(), null, Utils.dupChar(quality, length)));
        }
        return reads;
    }

    public static Path writeFastq(final Path output, final List<FastqRecord> reads, final boolean gzip) {
        try (final OutputStream raw = Files.newOutputStream(output);
             final OutputStream out = gzip ? new GZIPOutputStream(raw) : raw;
             final BasicFastqWriter writer = new BasicFastqWriter(new PrintStream(out))) {
            reads.forEach(writer::write);
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
        return output;
    }

    /**
     * Keeps only the first {@code fraction} of the bytes of {@code file}.
     */
    public static void truncate(final Path file, final double fraction) {
        try {
            final byte[] bytes = Files.readAllBytes(file);
            Files.write(file, Arrays.copyOf(bytes, (int) (bytes.length * fraction)));
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
