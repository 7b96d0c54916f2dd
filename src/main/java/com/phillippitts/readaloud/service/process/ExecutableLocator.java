package com.phillippitts.readaloud.service.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves executables the way a shell would: explicit paths as-is, bare names against PATH.
 */
public final class ExecutableLocator {

    private final String searchPath;

    public ExecutableLocator() {
        this(System.getenv("PATH"));
    }

    /**
     * @param searchPath PATH-style list of directories (may be null)
     */
    public ExecutableLocator(String searchPath) {
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    /**
     * @param executable bare command name or path
     * @return executable file, or empty if it cannot be found
     */
    public Optional<Path> find(String executable) {
        if (executable == null || executable.isBlank()) {
            return Optional.empty();
        }
        if (executable.contains(File.separator)) {
            Path path = Path.of(executable);
            return Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public boolean isAvailable(String executable) {
        return find(executable).isPresent();
    }
}
