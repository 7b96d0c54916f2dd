package com.phillippitts.readaloud.service.playback;

import com.phillippitts.readaloud.service.process.ExecutableLocator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command-line audio players supported by {@link ExternalPlayerDevice}, in auto-detection order.
 */
public enum PlayerCommand {
    FFPLAY("ffplay", "-nodisp", "-autoexit", "-loglevel", "quiet"),
    MPV("mpv", "--no-video", "--really-quiet"),
    PAPLAY("paplay"),
    APLAY("aplay", "-q");

    public static final String AUTO = "auto";

    private final String executable;
    private final List<String> arguments;

    PlayerCommand(String executable, String... arguments) {
        this.executable = executable;
        this.arguments = List.of(arguments);
    }

    public String executable() {
        return executable;
    }

    /**
     * @param audio file to play
     * @return full command line
     */
    public List<String> commandFor(Path audio) {
        List<String> command = new ArrayList<>(arguments.size() + 2);
        command.add(executable);
        command.addAll(arguments);
        command.add(audio.toAbsolutePath().toString());
        return command;
    }

    /**
     * Resolves a configured player name.
     *
     * @param preference player name, or {@value #AUTO} for the first one found on PATH
     * @param locator    PATH lookup
     * @return usable player, or empty if none is installed
     * @throws IllegalArgumentException if {@code preference} names no known player
     */
    public static Optional<PlayerCommand> detect(String preference, ExecutableLocator locator) {
        if (preference == null || preference.isBlank() || AUTO.equalsIgnoreCase(preference)) {
            return Arrays.stream(values()).filter(p -> locator.isAvailable(p.executable)).findFirst();
        }
        PlayerCommand requested = valueOf(preference.trim().toUpperCase(Locale.ROOT));
        return locator.isAvailable(requested.executable) ? Optional.of(requested) : Optional.empty();
    }
}
