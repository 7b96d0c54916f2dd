package com.phillippitts.readaloud;

import com.phillippitts.readaloud.config.properties.ChunkingProperties;
import com.phillippitts.readaloud.config.properties.FeederProperties;
import com.phillippitts.readaloud.config.properties.PlaybackProperties;
import com.phillippitts.readaloud.config.properties.ProgressProperties;
import com.phillippitts.readaloud.config.properties.SynthesisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ChunkingProperties.class,
        FeederProperties.class,
        SynthesisProperties.class,
        PlaybackProperties.class,
        ProgressProperties.class
})
@EnableScheduling
public class ReadAloudApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadAloudApplication.class, args);
    }

}
