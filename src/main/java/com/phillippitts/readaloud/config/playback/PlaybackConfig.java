package com.phillippitts.readaloud.config.playback;

import com.phillippitts.readaloud.config.properties.PlaybackProperties;
import com.phillippitts.readaloud.exception.PlaybackException;
import com.phillippitts.readaloud.service.playback.ExternalPlayerDevice;
import com.phillippitts.readaloud.service.playback.JavaSoundPlaybackDevice;
import com.phillippitts.readaloud.service.playback.PlaybackDeviceFactory;
import com.phillippitts.readaloud.service.playback.PlayerCommand;
import com.phillippitts.readaloud.service.playback.WavFileDevice;
import com.phillippitts.readaloud.service.process.ExecutableLocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Selects the playback device from {@code playback.device}: {@code javasound}, {@code process}
 * (external player) or {@code file} (WAV output).
 */
@Configuration
public class PlaybackConfig {

    private static final Logger LOG = LogManager.getLogger(PlaybackConfig.class);

    static final String SESSION_PLACEHOLDER = "{session}";

    @Bean
    public PlaybackDeviceFactory playbackDeviceFactory(PlaybackProperties properties) {
        String device = properties.device().trim().toLowerCase(Locale.ROOT);
        return switch (device) {
            case JavaSoundPlaybackDevice.DEVICE_NAME -> new PlaybackDeviceFactory(device,
                    JavaSoundPlaybackDevice::isSupported, sessionId -> new JavaSoundPlaybackDevice());
            case ExternalPlayerDevice.DEVICE_NAME -> externalPlayerFactory(properties.player());
            case WavFileDevice.DEVICE_NAME -> new PlaybackDeviceFactory(device, () -> true,
                    sessionId -> new WavFileDevice(outputPath(properties.outputPath(), sessionId)));
            default -> throw new IllegalStateException("Unknown playback.device: " + properties.device()
                    + " (expected javasound, process or file)");
        };
    }

    private static PlaybackDeviceFactory externalPlayerFactory(String preference) {
        Optional<PlayerCommand> player = PlayerCommand.detect(preference, new ExecutableLocator());
        if (player.isPresent()) {
            LOG.info("Using external player: {}", player.get().executable());
        } else {
            LOG.warn("No supported audio player ({}) found on PATH; playback will fail", preference);
        }
        return new PlaybackDeviceFactory(ExternalPlayerDevice.DEVICE_NAME, player::isPresent,
                sessionId -> new ExternalPlayerDevice(player.orElseThrow(() -> new PlaybackException(
                        "No supported audio player found on PATH", ExternalPlayerDevice.DEVICE_NAME))));
    }

    /**
     * Resolves the output file of a session; {@code {session}} in the configured path is replaced
     * by the session id.
     */
    static Path outputPath(String template, String sessionId) {
        return Path.of(template.replace(SESSION_PLACEHOLDER, sessionId));
    }
}
