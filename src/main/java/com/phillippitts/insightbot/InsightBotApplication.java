package com.phillippitts.insightbot;

import com.phillippitts.insightbot.config.audio.AudioCaptureProperties;
import com.phillippitts.insightbot.config.audio.AudioConversionProperties;
import com.phillippitts.insightbot.config.properties.GeminiProperties;
import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.config.properties.SpeakerDirectoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        GeminiProperties.class,
        SpeakerDirectoryProperties.class,
        AudioCaptureProperties.class,
        AudioConversionProperties.class
})
@EnableScheduling
public class InsightBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightBotApplication.class, args);
    }

}
