package com.phillippitts.readaloud.service.synthesis;

import com.phillippitts.readaloud.domain.VoiceParams;
import com.phillippitts.readaloud.exception.SynthesisException;

import java.nio.file.Path;

/**
 * Contract for text-to-speech engines.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with its configuration</li>
 *   <li>{@link #initialize()} prepares the engine; an engine that cannot be prepared reports
 *       itself unhealthy instead of failing application startup</li>
 *   <li>{@link #synthesize(String, VoiceParams, Path)} turns one chunk of text into one audio file</li>
 *   <li>{@link #close()} releases resources when the engine is no longer needed</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must support concurrent calls, one per synthesis worker.
 * A call whose thread is interrupted should abort as soon as it can; the worker pool interrupts
 * calls that exceed the synthesis timeout.
 */
public interface SynthesisEngine extends AutoCloseable {

    void initialize();

    /**
     * Synthesizes one chunk of text.
     *
     * @param text   chunk text, never blank
     * @param voice  voice and language
     * @param output file the audio must be written to
     * @return result describing the written audio
     * @throws SynthesisException if synthesis fails or produces no audio
     */
    SynthesisResult synthesize(String text, VoiceParams voice, Path output);

    /**
     * @return engine name for logging, metrics and errors (e.g. "process", "silent")
     */
    String getEngineName();

    /**
     * @return true if the engine is initialized and able to synthesize
     */
    boolean isHealthy();

    @Override
    void close();
}
