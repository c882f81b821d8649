package org.assemblerflow.qc.utils.io;

import org.apache.commons.io.FileUtils;
import org.assemblerflow.qc.exceptions.QCException;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.Utils;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class IOUtils {

    private IOUtils(){}

    /**
     * Reads the leading bytes of {@code candidate} and returns the compression they announce.
     * @throws UserException.CouldNotReadInputFile if the file cannot be opened
     */
    public static CompressionType detectCompression(final Path candidate) {
        Utils.nonNull(candidate);
        try (final InputStream candidateStream = Files.newInputStream(candidate)) {
            final byte[] candidateHeader = new byte[CompressionType.MAX_SIGNATURE_LENGTH];
            final int read = readFully(candidateStream, candidateHeader);
            return CompressionType.fromHeader(candidateHeader, read);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(String.format("I/O error reading from input stream %s", candidate), e);
        }
    }

    private static int readFully(final InputStream in, final byte[] buffer) throws IOException {
        int total = 0;
        while (total < buffer.length) {
            final int n = in.read(buffer, total, buffer.length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    /**
     * Opens a text reader over {@code path}, decompressing it according to its magic bytes.
     * File extensions are not consulted.
     *
     * @throws IOException if the file cannot be opened or the compressed stream header is unreadable
     */
    public static BufferedReader makeReaderMaybeCompressed(final Path path) throws IOException {
        return makeReader(path, detectCompression(path));
    }

    /**
     * Opens a text reader over {@code path} using the given compression.
     */
    public static BufferedReader makeReader(final Path path, final CompressionType compression) throws IOException {
        Utils.nonNull(path);
        Utils.nonNull(compression);
        final InputStream raw = new BufferedInputStream(Files.newInputStream(path));
        try {
            return new BufferedReader(new InputStreamReader(compression.decompress(raw), StandardCharsets.UTF_8));
        } catch (final IOException | RuntimeException e) {
            raw.close();
            throw e;
        }
    }

    /**
     * Writes {@code lines}, each followed by a newline, to {@code path}, replacing any existing content.
     */
    public static void writeLines(final Path path, final List<String> lines) {
        Utils.nonNull(path);
        Utils.nonNull(lines);
        try {
            FileUtils.writeLines(path.toFile(), StandardCharsets.UTF_8.name(), lines, "\n");
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, "could not write lines", e);
        }
    }

    /**
     * Writes {@code content} verbatim to {@code path}, replacing any existing content.
     */
    public static void writeString(final Path path, final String content) {
        Utils.nonNull(path);
        Utils.nonNull(content);
        try {
            FileUtils.writeStringToFile(path.toFile(), content, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, "could not write file", e);
        }
    }

    /**
     * Copies {@code source} byte for byte to {@code destination}, replacing any existing file.
     */
    public static void copyFile(final Path source, final Path destination) {
        Utils.nonNull(source);
        Utils.nonNull(destination);
        try {
            FileUtils.copyFile(source.toFile(), destination.toFile());
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(destination, "could not copy " + source, e);
        }
    }

    /**
     * Creates the directory (and any missing parents) if it does not exist yet.
     */
    public static void createDirectories(final Path directory) {
        Utils.nonNull(directory);
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(directory, "could not create output directory", e);
        }
    }

    /**
     * Creates a temp file that will be deleted on exit
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(String name, String extension) {
        try {
            if ( !extension.startsWith(".") ) {
                extension = "." + extension;
            }
            final File file = File.createTempFile(name, extension);
            file.deleteOnExit();
            return file;
        } catch (IOException ex) {
            throw new QCException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Creates a temp directory with the given prefix.
     *
     * The directory and any contents will be automatically deleted at shutdown.
     *
     * @param prefix       Prefix for the directory name.
     * @return The newly created temporary directory.
     */
    public static File createTempDir(String prefix) {
        try {
            final File tmpDir = Files.createTempDirectory(prefix).normalize().toFile();
            FileUtils.forceDeleteOnExit(tmpDir);
            return tmpDir;
        } catch (final IOException | SecurityException e) {
            throw new QCException("Cannot create temp directory: " + e.getMessage(), e);
        }
    }
}
