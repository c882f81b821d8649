package org.assemblerflow.qc.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(String message, Exception e) {
            super(String.format("Couldn't read file. Error was: %s with exception: %s", message, getMessage(e)), e);
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(String source, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", source, message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.getAbsolutePath(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final Path path, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", path.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final String filename, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final String message, final Exception e) {
            super(message, e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }

        public BadInput(String message, Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.MalformedFile
     * <p/>
     * For errors parsing sequence files and tables whose content does not follow the expected layout
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(String message) {
            super(String.format("File is malformed: %s", message));
        }

        public MalformedFile(String source, String message) {
            super(String.format("File %s is malformed: %s", source, message));
        }

        public MalformedFile(String source, String message, Throwable cause) {
            super(String.format("File %s is malformed: %s", source, message), cause);
        }
    }

    /**
     * A contig header that lacks the structured token a caller needs to extract from it
     * (the {@code NODE_<n>} id, the {@code length_<n>} field or the trailing coverage value).
     */
    public static class MalformedContigHeader extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedContigHeader(final String header, final String expected) {
            super(String.format("Contig header '%s' does not contain %s", header, expected));
        }

        public MalformedContigHeader(final String header, final String expected, final Throwable cause) {
            super(String.format("Contig header '%s' does not contain %s", header, expected), cause);
        }
    }

    /**
     * Raised when per-base or per-contig coverage was requested for a contig that the depth data does not describe.
     * A missing contig is never treated as zero coverage.
     */
    public static class MissingContigCoverage extends UserException {
        private static final long serialVersionUID = 0L;

        private final String contig;

        public MissingContigCoverage(final String contig, final String source) {
            super(String.format("No coverage entry for contig '%s' in %s", contig, source));
            this.contig = contig;
        }

        public String getContig() {
            return contig;
        }
    }

    /**
     * A read file that ends prematurely: a truncated compressed stream or an incomplete FASTQ record.
     */
    public static class CorruptedReadFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CorruptedReadFile(final String source, final String message) {
            super(String.format("Read file %s is corrupted: %s", source, message));
        }

        public CorruptedReadFile(final String source, final String message, final Throwable cause) {
            super(String.format("Read file %s is corrupted: %s", source, message), cause);
        }
    }
}
