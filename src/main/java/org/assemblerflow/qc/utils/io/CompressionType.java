package org.assemblerflow.qc.utils.io;

import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.zip.GZIPInputStream;

/**
 * Compression formats recognized from the leading bytes of a file.
 *
 * The signatures are checked in declaration order; a file that matches none of them is read as plain text.
 */
public enum CompressionType {

    GZIP(new byte[]{0x1f, (byte) 0x8b, 0x08}) {
        @Override
        public InputStream decompress(final InputStream in) throws IOException {
            return new GZIPInputStream(in);
        }
    },

    BZIP2(new byte[]{0x42, 0x5a, 0x68}) {
        @Override
        public InputStream decompress(final InputStream in) throws IOException {
            return new BZip2CompressorInputStream(in, true);
        }
    },

    /**
     * Only the first entry of a zip archive is read.
     */
    ZIP(new byte[]{0x50, 0x4b, 0x03, 0x04}) {
        @Override
        public InputStream decompress(final InputStream in) throws IOException {
            final ZipArchiveInputStream zipStream = new ZipArchiveInputStream(in);
            if (zipStream.getNextEntry() == null) {
                zipStream.close();
                throw new EOFException("zip archive has no entries");
            }
            return zipStream;
        }
    },

    NONE(new byte[0]) {
        @Override
        public InputStream decompress(final InputStream in) {
            return in;
        }
    };

    /**
     * Number of leading bytes needed to tell every known signature apart.
     */
    public static final int MAX_SIGNATURE_LENGTH = 4;

    private final byte[] signature;

    CompressionType(final byte[] signature) {
        this.signature = signature;
    }

    /**
     * Wraps {@code in}, positioned at the start of the file, in the matching decompressing stream.
     */
    public abstract InputStream decompress(final InputStream in) throws IOException;

    public boolean matches(final byte[] header, final int headerLength) {
        return signature.length > 0
                && headerLength >= signature.length
                && Arrays.equals(Arrays.copyOf(header, signature.length), signature);
    }

    /**
     * @param header the first bytes of a file
     * @param headerLength how many bytes of {@code header} were actually read (may be less than its length)
     * @return the first compression type whose signature prefixes {@code header}, or {@link #NONE}
     */
    public static CompressionType fromHeader(final byte[] header, final int headerLength) {
        for (final CompressionType type : values()) {
            if (type.matches(header, headerLength)) {
                return type;
            }
        }
        return NONE;
    }
}
