package com.phillippitts.readaloud.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes minimal PCM WAV files: 16-bit signed little-endian mono at a caller-chosen sample rate.
 */
public final class WavWriter {

    /** Size of the canonical RIFF/WAVE header written by this class. */
    public static final int HEADER_BYTES = 44;

    private static final int BITS_PER_SAMPLE = 16;
    private static final int CHANNELS = 1;

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given raw PCM16LE mono payload.
     *
     * @param pcm        raw PCM16LE mono audio
     * @param sampleRate sample rate in Hz
     * @param wavPath    output file path (will be created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public static void writePcm16LeMono(byte[] pcm, int sampleRate, Path wavPath) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        int blockAlign = CHANNELS * BITS_PER_SAMPLE / 8;
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1);
            writeLEShort(os, (short) CHANNELS);
            writeLEInt(os, sampleRate);
            writeLEInt(os, sampleRate * blockAlign);
            writeLEShort(os, (short) blockAlign);
            writeLEShort(os, (short) BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, pcm.length);

            os.write(pcm);
            os.flush();
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
