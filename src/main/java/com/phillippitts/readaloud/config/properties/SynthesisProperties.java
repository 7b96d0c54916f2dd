package com.phillippitts.readaloud.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Synthesis worker pool and engine configuration. Binds to properties prefixed with "synthesis".
 *
 * <p>Example application.properties:
 * <pre>
 * synthesis.workers=2
 * synthesis.timeout-ms=30000
 * synthesis.engine=process
 * synthesis.language=en-us
 * synthesis.process.command=espeak-ng,--stdin,-v,{voice},-w,{output}
 * </pre>
 *
 * @param workers number of concurrent synthesis workers per session
 * @param timeoutMs per-chunk synthesis timeout in milliseconds
 * @param retryFailedOnce retry a failed chunk once before marking it failed
 * @param engine engine selector: {@code process} or {@code silent}
 * @param voice voice id passed to the engine; blank means "use the language code"
 * @param language language code passed to the engine
 * @param process settings of the subprocess engine
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public record SynthesisProperties(
        @DefaultValue("2")
        @Positive(message = "Worker count must be positive")
        int workers,

        @DefaultValue("30000")
        @Positive(message = "Synthesis timeout must be positive")
        long timeoutMs,

        @DefaultValue("false")
        boolean retryFailedOnce,

        @DefaultValue("process")
        @NotBlank(message = "Synthesis engine must not be blank")
        String engine,

        @DefaultValue("")
        String voice,

        @DefaultValue("en-us")
        @NotBlank(message = "Language must not be blank")
        String language,

        @Valid
        @DefaultValue
        Process process
) {

    /**
     * Subprocess engine settings.
     *
     * @param command command template; {@code {output}}, {@code {voice}}, {@code {language}} and
     *                {@code {text}} are substituted per call. Without {@code {text}} the chunk text
     *                is written to stdin
     * @param maxStderrBytes cap on captured stderr used in error reports
     */
    public record Process(
            @DefaultValue({"espeak-ng", "--stdin", "-v", "{voice}", "-w", "{output}"})
            @NotEmpty(message = "Synthesis command must not be empty")
            List<String> command,

            @DefaultValue("8192")
            @Positive(message = "Max stderr bytes must be positive")
            int maxStderrBytes
    ) {
        public Process {
            command = List.copyOf(command);
        }
    }
}
