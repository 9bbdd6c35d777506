package net.proxymachine.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens catalog dumps that may be gzip- or zip-compressed, picking the codec from the
 * leading magic bytes rather than the file extension.
 */
public final class CompressionUtils {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Compression detected from a stream header.
     */
    public enum Compression {
        GZIP,
        ZIP,
        NONE
    }

    private CompressionUtils() {
    }

    /**
     * Detect the compression of the given header bytes.
     *
     * @param header the first bytes of a file (at least four are inspected when present)
     * @param length number of valid bytes in {@code header}
     * @return the detected compression, {@link Compression#NONE} when no magic matches
     */
    public static Compression detect(byte[] header, int length) {
        if (header == null || length < 2) {
            return Compression.NONE;
        }
        if ((header[0] & 0xFF) == 0x1F && (header[1] & 0xFF) == 0x8B) {
            return Compression.GZIP;
        }
        if (length >= 4 && header[0] == 'P' && header[1] == 'K' && header[2] == 3 && header[3] == 4) {
            return Compression.ZIP;
        }
        return Compression.NONE;
    }

    /**
     * Opens the file and returns a stream over its decompressed content. For zip archives
     * the first non-directory entry is used.
     *
     * @throws IOException when the file cannot be read or a zip archive holds no entries
     */
    public static InputStream openDecompressed(Path path) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE);
        try {
            buffered.mark(4);
            byte[] header = new byte[4];
            int read = buffered.readNBytes(header, 0, header.length);
            buffered.reset();

            switch (detect(header, read)) {
                case GZIP:
                    return new BufferedInputStream(new GZIPInputStream(buffered, BUFFER_SIZE), BUFFER_SIZE);
                case ZIP:
                    return openFirstZipEntry(buffered, path);
                default:
                    return buffered;
            }
        } catch (IOException | RuntimeException ex) {
            buffered.close();
            throw ex;
        }
    }

    private static InputStream openFirstZipEntry(InputStream raw, Path path) throws IOException {
        ZipInputStream zip = new ZipInputStream(raw);
        ZipEntry entry = zip.getNextEntry();
        while (entry != null && entry.isDirectory()) {
            entry = zip.getNextEntry();
        }
        if (entry == null) {
            zip.close();
            throw new IOException("Zip archive contains no file entries: " + path);
        }
        return new BufferedInputStream(zip, BUFFER_SIZE);
    }
}
