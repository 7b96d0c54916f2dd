package com.phillippitts.readaloud.exception;

import com.phillippitts.readaloud.domain.FailureReason;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link SynthesisException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw SynthesisExceptionBuilder.create("Non-zero exit: 1")
 *         .engine("process")
 *         .chunkIndex(3)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String engineName;
    private FailureReason reason = FailureReason.ENGINE_ERROR;
    private Throwable cause;
    private Integer chunkIndex;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    public SynthesisExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public SynthesisExceptionBuilder reason(FailureReason reason) {
        this.reason = reason;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public SynthesisExceptionBuilder chunkIndex(int chunkIndex) {
        this.chunkIndex = chunkIndex;
        return this;
    }

    public SynthesisExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (chunk={index}, exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed SynthesisException
     */
    public SynthesisException build() {
        String engine = engineName != null ? engineName : "unknown";
        return new SynthesisException(buildDetailedMessage(), engine, reason, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (chunkIndex != null) {
            details.put("chunk", String.valueOf(chunkIndex));
        }
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
