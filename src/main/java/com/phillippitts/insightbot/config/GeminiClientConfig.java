package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.config.properties.GeminiProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP client for the Gemini analysis backend.
 */
@Configuration
public class GeminiClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * RestClient with the backend read timeout ({@code gemini.timeout}). Uploads and
     * generateContent calls can take minutes for long recordings.
     */
    @Bean(name = "geminiRestClient")
    public RestClient geminiRestClient(RestClient.Builder builder, GeminiProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(props.timeout());
        return builder.requestFactory(requestFactory).build();
    }
}
