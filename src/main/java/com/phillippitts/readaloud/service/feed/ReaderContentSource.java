package com.phillippitts.readaloud.service.feed;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Source reading from any {@link Reader}: a UTF-8 file, standard input, or a socket stream.
 */
public final class ReaderContentSource implements ContentSource {

    private final String sourceId;
    private final Reader reader;
    private final char[] buffer;
    private final OptionalLong estimatedLength;

    public ReaderContentSource(String sourceId, Reader reader, int bufferChars) {
        this(sourceId, reader, bufferChars, OptionalLong.empty());
    }

    private ReaderContentSource(String sourceId, Reader reader, int bufferChars, OptionalLong estimatedLength) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        if (bufferChars <= 0) {
            throw new IllegalArgumentException("bufferChars must be positive, got: " + bufferChars);
        }
        this.buffer = new char[bufferChars];
        this.estimatedLength = estimatedLength;
    }

    /**
     * Opens a UTF-8 text file. The file size in bytes serves as the length estimate.
     *
     * @param file        file to read
     * @param bufferChars characters per read
     * @return source over the file
     * @throws IOException if the file cannot be opened
     */
    public static ReaderContentSource ofFile(Path file, int bufferChars) throws IOException {
        return ofFile(String.valueOf(file.getFileName()), file, bufferChars);
    }

    /**
     * Opens a UTF-8 text file under a caller-chosen source id.
     *
     * @throws IOException if the file cannot be opened
     */
    public static ReaderContentSource ofFile(String sourceId, Path file, int bufferChars) throws IOException {
        long size = Files.size(file);
        Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        return new ReaderContentSource(sourceId, reader, bufferChars, OptionalLong.of(size));
    }

    /**
     * @param bufferChars characters per read
     * @return source over standard input (UTF-8)
     */
    public static ReaderContentSource ofStdin(int bufferChars) {
        return new ReaderContentSource("stdin", new InputStreamReader(System.in, StandardCharsets.UTF_8), bufferChars);
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public Optional<String> read() throws IOException {
        int n;
        do {
            n = reader.read(buffer, 0, buffer.length);
        } while (n == 0);
        if (n < 0) {
            return Optional.empty();
        }
        return Optional.of(new String(buffer, 0, n));
    }

    @Override
    public OptionalLong estimatedLength() {
        return estimatedLength;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
