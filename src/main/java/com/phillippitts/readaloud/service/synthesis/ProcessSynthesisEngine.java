package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.config.properties.SynthesisProperties;
import com.phillippitts.readaloud.domain.FailureReason;
import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.exception.SynthesisException;
import com.phillippitts.readaloud.exception.SynthesisExceptionBuilder;
import com.phillippitts.readaloud.service.audio.AudioDurations;
import com.phillippitts.readaloud.service.audio.WavWriter;
import com.phillippitts.readaloud.service.process.DefaultProcessFactory;
import com.phillippitts.readaloud.service.process.ExecutableLocator;
import com.phillippitts.readaloud.service.process.ProcessFactory;
import com.phillippitts.readaloud.service.process.ProcessSupport;
import com.phillippitts.readaloud.util.ProcessTimeouts;
import com.phillippitts.readaloud.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synthesizes speech by running an external TTS command once per chunk.
 *
 * <p>The command is a template. Per call, {@code {output}} is replaced by the target WAV path,
 * {@code {voice}} by the voice id and {@code {language}} by the language code. If the template
 * contains {@code {text}} the chunk text is passed as an argument, otherwise it is written to the
 * process's stdin. The default template drives espeak-ng:
 * <pre>
 * espeak-ng --stdin -v {voice} -w {output}
 * </pre>
 *
 * <p>Each call owns its own process, so concurrent calls are independent. Interrupting the
 * calling thread destroys the process.
 */
public final class ProcessSynthesisEngine extends AbstractSynthesisEngine {

    private static final Logger LOG = LogManager.getLogger(ProcessSynthesisEngine.class);

    public static final String ENGINE_NAME = "process";

    static final String OUTPUT_PLACEHOLDER = "{output}";
    static final String VOICE_PLACEHOLDER = "{voice}";
    static final String LANGUAGE_PLACEHOLDER = "{language}";
    static final String TEXT_PLACEHOLDER = "{text}";

    private static final int ERROR_SNIPPET_MAX_CHARS = 512;

    private final List<String> commandTemplate;
    private final int maxStderrBytes;
    private final ProcessFactory processFactory;
    private final ExecutableLocator locator;
    private final boolean textAsArgument;

    public ProcessSynthesisEngine(SynthesisProperties.Process config) {
        this(config.command(), config.maxStderrBytes(), new DefaultProcessFactory(), new ExecutableLocator());
    }

    ProcessSynthesisEngine(List<String> commandTemplate, int maxStderrBytes,
                           ProcessFactory processFactory, ExecutableLocator locator) {
        Objects.requireNonNull(commandTemplate, "commandTemplate must not be null");
        if (commandTemplate.isEmpty() || commandTemplate.get(0).isBlank()) {
            throw new IllegalArgumentException("commandTemplate must name an executable");
        }
        if (maxStderrBytes <= 0) {
            throw new IllegalArgumentException("maxStderrBytes must be positive, got: " + maxStderrBytes);
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.maxStderrBytes = maxStderrBytes;
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
        this.textAsArgument = this.commandTemplate.stream().anyMatch(arg -> arg.contains(TEXT_PLACEHOLDER));
    }

    @Override
    protected void doInitialize() {
        String executable = commandTemplate.get(0);
        if (locator.find(executable).isEmpty()) {
            throw new SynthesisException("Executable not found: " + executable, ENGINE_NAME);
        }
        LOG.info("Process synthesis engine ready: {}", String.join(" ", commandTemplate));
    }

    @Override
    protected void doClose() {
        LOG.debug("Process synthesis engine closed");
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public SynthesisResult synthesize(String text, VoiceParams voice, Path output) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
        Objects.requireNonNull(output, "output must not be null");
        ensureInitialized();

        List<String> command = buildCommand(text, voice, output);
        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(command, output.toAbsolutePath().getParent());
            // Start gobblers before writing stdin to avoid a pipe deadlock
            outGobbler = ProcessSupport.startGobbler(process.getInputStream(), stdout, "synth-out", maxStderrBytes);
            errGobbler = ProcessSupport.startGobbler(process.getErrorStream(), stderr, "synth-err", maxStderrBytes);
            writeStdin(process, textAsArgument ? null : text);

            int exitCode = process.waitFor();
            ProcessSupport.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            ProcessSupport.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, FailureReason.ENGINE_ERROR, exitCode, stderr,
                        startTime, null);
            }
            verifyAudio(output, stderr, startTime);
            LOG.debug("Synthesized {} chars in {} ms", text.length(), TimeUtils.elapsedMillis(startTime));
            return new SynthesisResult(output, AudioDurations.of(output, text));
        } catch (IOException e) {
            throw error("I/O failure: " + e.getMessage(), FailureReason.ENGINE_ERROR, -1, stderr, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted", FailureReason.CANCELLED, -1, stderr, startTime, e);
        } finally {
            ProcessSupport.destroy(process);
            ProcessSupport.joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            ProcessSupport.joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    List<String> buildCommand(String text, VoiceParams voice, Path output) {
        List<String> command = new ArrayList<>(commandTemplate.size());
        String outputPath = output.toAbsolutePath().toString();
        for (String arg : commandTemplate) {
            command.add(arg.replace(OUTPUT_PLACEHOLDER, outputPath)
                    .replace(VOICE_PLACEHOLDER, voice.voice())
                    .replace(LANGUAGE_PLACEHOLDER, voice.language())
                    .replace(TEXT_PLACEHOLDER, text));
        }
        return command;
    }

    private static void writeStdin(Process process, String text) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (text != null) {
                stdin.write(text.getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
        } catch (IOException e) {
            // Process exited early; its exit code and stderr tell the real story
            LOG.debug("Could not write chunk text to stdin: {}", e.toString());
        }
    }

    private void verifyAudio(Path output, StringBuilder stderr, long startTime) {
        long size;
        try {
            size = Files.exists(output) ? Files.size(output) : 0L;
        } catch (IOException e) {
            throw error("Cannot read output: " + e.getMessage(), FailureReason.EMPTY_AUDIO, 0, stderr, startTime, e);
        }
        if (size <= WavWriter.HEADER_BYTES) {
            throw error("No audio produced", FailureReason.EMPTY_AUDIO, 0, stderr, startTime, null);
        }
    }

    private SynthesisException error(String msg, FailureReason reason, int exitCode, StringBuilder stderr,
                                     long startTime, Throwable cause) {
        SynthesisExceptionBuilder builder = SynthesisExceptionBuilder.create(msg)
                .engine(ENGINE_NAME)
                .reason(reason)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startTime))
                .metadata("command", commandTemplate.get(0));
        String snippet = ProcessSupport.snippet(stderr, ERROR_SNIPPET_MAX_CHARS);
        if (!snippet.isBlank()) {
            builder.metadata("stderr", snippet);
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
