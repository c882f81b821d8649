package org.assemblerflow.qc.utils.io;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.GZIPOutputStream;

public final class IOUtilsUnitTest extends QCBaseTest {

    private static final String CONTENT = "@read1\nACGT\n+\nIIII\n";

    private static Path writeCompressed(final CompressionType type) throws IOException {
        final File file = createTempFile("compressed-" + type.name(), ".bin");
        try (final OutputStream raw = Files.newOutputStream(file.toPath())) {
            switch (type) {
                case GZIP:
                    try (final GZIPOutputStream out = new GZIPOutputStream(raw)) {
                        out.write(CONTENT.getBytes(StandardCharsets.UTF_8));
                    }
                    break;
                case BZIP2:
                    try (final BZip2CompressorOutputStream out = new BZip2CompressorOutputStream(raw)) {
                        out.write(CONTENT.getBytes(StandardCharsets.UTF_8));
                    }
                    break;
                case ZIP:
                    try (final ZipArchiveOutputStream out = new ZipArchiveOutputStream(raw)) {
                        out.putArchiveEntry(new ZipArchiveEntry("reads.fq"));
                        out.write(CONTENT.getBytes(StandardCharsets.UTF_8));
                        out.closeArchiveEntry();
                    }
                    break;
                default:
                    raw.write(CONTENT.getBytes(StandardCharsets.UTF_8));
            }
        }
        return file.toPath();
    }

    @DataProvider(name = "compressionTypes")
    public Object[][] compressionTypes() {
        return Arrays.stream(CompressionType.values()).map(t -> new Object[]{t}).toArray(Object[][]::new);
    }

    @Test(dataProvider = "compressionTypes")
    public void testDetectCompressionAndRead(final CompressionType type) throws IOException {
        final Path file = writeCompressed(type);
        Assert.assertEquals(IOUtils.detectCompression(file), type);
        try (final BufferedReader reader = IOUtils.makeReaderMaybeCompressed(file)) {
            Assert.assertEquals(reader.lines().collect(Collectors.toList()), Arrays.asList("@read1", "ACGT", "+", "IIII"));
        }
    }

    @Test
    public void testShortFileIsPlain() {
        final Path file = createTempFile("short", ".txt").toPath();
        IOUtils.writeString(file, "A");
        Assert.assertEquals(IOUtils.detectCompression(file), CompressionType.NONE);
    }

    @Test
    public void testFromHeaderNeedsFullSignature() {
        Assert.assertEquals(CompressionType.fromHeader(new byte[]{0x1f, (byte) 0x8b, 0x08, 0}, 4), CompressionType.GZIP);
        Assert.assertEquals(CompressionType.fromHeader(new byte[]{0x1f, (byte) 0x8b, 0, 0}, 2), CompressionType.NONE);
        Assert.assertEquals(CompressionType.fromHeader(new byte[]{0x50, 0x4b, 0x03, 0x04}, 4), CompressionType.ZIP);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testDetectCompressionOfMissingFile() {
        IOUtils.detectCompression(getSafeNonExistentFile("missing.fq").toPath());
    }

    @Test
    public void testWriteLinesTerminatesEveryLine() throws IOException {
        final Path file = createTempFile("lines", ".txt").toPath();
        IOUtils.writeLines(file, Arrays.asList("a", "b"));
        Assert.assertEquals(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), "a\nb\n");
    }

    @Test
    public void testWriteStringWritesExactly() throws IOException {
        final Path file = createTempFile("string", ".txt").toPath();
        IOUtils.writeString(file, "pass");
        Assert.assertEquals(new String(Files.readAllBytes(file), StandardCharsets.UTF_8), "pass");
    }

    @Test
    public void testCopyFile() throws IOException {
        final Path source = writeCompressed(CompressionType.GZIP);
        final Path destination = new File(createTempDir("copy"), "copy.gz").toPath();
        IOUtils.copyFile(source, destination);
        Assert.assertEquals(Files.readAllBytes(destination), Files.readAllBytes(source));
    }

    @Test
    public void testCreateDirectories() {
        final Path nested = createTempDir("dirs").toPath().resolve("a").resolve("b");
        IOUtils.createDirectories(nested);
        Assert.assertTrue(Files.isDirectory(nested));
        // already existing
        IOUtils.createDirectories(nested);
    }

    @Test(expectedExceptions = UserException.CouldNotCreateOutputFile.class)
    public void testWriteOntoDirectory() {
        IOUtils.writeLines(createTempDir("isADirectory").toPath(), List.of("x"));
    }
}
