package com.vitalscan.assessment.config;

import com.vitalscan.assessment.client.BackoffSleeper;
import com.vitalscan.assessment.client.ThreadBackoffSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientConfig.class);

    @Bean
    @Qualifier("patientApiRestClient")
    RestClient patientApiRestClient(AssessmentProperties properties) {
        RestClient.Builder builder = RestClient.builder()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder = builder.defaultHeader(properties.getApiKeyHeader(), apiKey);
        } else {
            LOGGER.warn("No API key configured, requests to {} will be sent without {}",
                properties.getBaseUrl(), properties.getApiKeyHeader());
        }
        return builder.build();
    }

    @Bean
    BackoffSleeper backoffSleeper() {
        return new ThreadBackoffSleeper();
    }
}
