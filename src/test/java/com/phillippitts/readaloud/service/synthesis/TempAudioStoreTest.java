package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.AudioArtifact;
import com.phillippitts.readaloud.domain.FailureReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TempAudioStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldNameFilesByIndexAndAttempt() {
        try (TempAudioStore store = TempAudioStore.in(tempDir, "s1")) {
            assertThat(store.fileFor(7, 2).getFileName().toString()).isEqualTo("chunk-00007-2.wav");
            assertThat(store.fileFor(7, 2).getParent()).isEqualTo(store.directory());
            assertThat(store.directory().getFileName().toString()).startsWith("readaloud-s1-");
        }
    }

    @Test
    void shouldDeleteReleasedAudioAndIgnoreFailedArtifacts() throws Exception {
        try (TempAudioStore store = TempAudioStore.in(tempDir, "s1")) {
            Path audio = Files.createFile(store.fileFor(0, 1));

            store.release(AudioArtifact.ready(0, audio, Duration.ofSeconds(1)));
            store.release(AudioArtifact.failed(1, FailureReason.TIMEOUT, "slow"));
            store.release(null);

            assertThat(audio).doesNotExist();
        }
    }

    @Test
    void shouldRemoveDirectoryOnClose() throws Exception {
        TempAudioStore store = TempAudioStore.in(tempDir, "s1");
        Files.createFile(store.fileFor(0, 1));
        Files.createFile(store.fileFor(1, 1));

        store.close();
        store.close();

        assertThat(store.directory()).doesNotExist();
    }

    @Test
    void shouldCreateStoreUnderSystemTemp() {
        TempAudioStore store = TempAudioStore.create("s2");
        try {
            assertThat(store.directory()).isDirectory();
        } finally {
            store.close();
        }
        assertThat(store.directory()).doesNotExist();
    }
}
