package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.AudioArtifact;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Per-session directory holding synthesized audio files.
 *
 * <p>Files are deleted as soon as they have been played or discarded; {@link #close()} removes
 * whatever is left together with the directory.
 */
public final class TempAudioStore implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TempAudioStore.class);

    private final Path directory;
    private final AtomicBoolean closed = new AtomicBoolean();

    private TempAudioStore(Path directory) {
        this.directory = directory;
    }

    /**
     * Creates a fresh store under the system temp directory.
     *
     * @param sessionId session the store belongs to, used as directory prefix
     * @return new store
     * @throws UncheckedIOException if the directory cannot be created
     */
    public static TempAudioStore create(String sessionId) {
        try {
            return new TempAudioStore(Files.createTempDirectory("readaloud-" + sessionId + "-"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp audio directory", e);
        }
    }

    /**
     * Creates a store in an existing parent directory.
     */
    public static TempAudioStore in(Path parent, String sessionId) {
        Objects.requireNonNull(parent, "parent must not be null");
        try {
            Files.createDirectories(parent);
            return new TempAudioStore(Files.createTempDirectory(parent, "readaloud-" + sessionId + "-"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp audio directory in " + parent, e);
        }
    }

    /**
     * @param index   chunk index
     * @param attempt synthesis attempt, starting at 1
     * @return path for the chunk's audio; the file itself is not created
     */
    public Path fileFor(int index, int attempt) {
        return directory.resolve(String.format("chunk-%05d-%d.wav", index, attempt));
    }

    /**
     * Deletes the audio of an artifact that has been played or discarded. Failed artifacts have no
     * audio and are ignored.
     */
    public void release(AudioArtifact artifact) {
        if (artifact != null && artifact.audio() != null) {
            delete(artifact.audio());
        }
    }

    public void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp audio {}: {}", file.getFileName(), e.toString());
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * Removes the directory and all remaining files. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true) || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::delete);
        } catch (IOException e) {
            LOG.warn("Failed to clean temp audio directory {}: {}", directory, e.toString());
        }
    }
}
