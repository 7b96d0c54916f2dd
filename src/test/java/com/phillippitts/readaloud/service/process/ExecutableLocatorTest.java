package com.phillippitts.readaloud.service.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutableLocatorTest {

    @TempDir
    Path tempDir;

    private Path executable(Path dir, String name) throws Exception {
        Path file = Files.createFile(Files.createDirectories(dir).resolve(name));
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Test
    void shouldFindBareNameOnSearchPath() throws Exception {
        // Arrange
        Path empty = Files.createDirectories(tempDir.resolve("empty"));
        Path player = executable(tempDir.resolve("bin"), "player");
        ExecutableLocator locator = new ExecutableLocator(
                empty + File.pathSeparator + File.pathSeparator + player.getParent());

        // Act & Assert
        assertThat(locator.find("player")).contains(player);
        assertThat(locator.isAvailable("player")).isTrue();
    }

    @Test
    void shouldIgnoreNonExecutableFiles() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("bin"));
        Files.createFile(dir.resolve("plain"));

        assertThat(new ExecutableLocator(dir.toString()).find("plain")).isEmpty();
    }

    @Test
    void shouldCheckExplicitPathDirectly() throws Exception {
        Path tool = executable(tempDir.resolve("tools"), "tts");
        ExecutableLocator locator = new ExecutableLocator((String) null);

        assertThat(locator.find(tool.toString())).contains(tool);
        assertThat(locator.find(tempDir.resolve("missing").toString())).isEmpty();
    }

    @Test
    void shouldReturnEmptyForBlankName() {
        ExecutableLocator locator = new ExecutableLocator(tempDir.toString());

        assertThat(locator.find(null)).isEmpty();
        assertThat(locator.find(" ")).isEmpty();
    }
}
