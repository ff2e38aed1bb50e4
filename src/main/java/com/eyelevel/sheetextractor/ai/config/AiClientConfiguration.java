package com.eyelevel.sheetextractor.ai.config;

import com.eyelevel.sheetextractor.common.apiclient.authentication.Authentication;
import com.eyelevel.sheetextractor.common.apiclient.authentication.impl.APIKeyAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} and the {@link Authentication} used to reach the AI inference service.
 */
@Slf4j
@Configuration
public class AiClientConfiguration {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Value("${app.ai-client.baseurl}")
    private String baseUrl;

    @Value("${app.ai-client.auth-key-name:Authorization}")
    private String headerName;

    @Value("${app.ai-client.auth-key-value:}")
    private String headerValue;

    @Bean("aiWebClient")
    public WebClient aiWebClient() {
        log.info("Initializing AI inference WebClient with base URL: {}", baseUrl);
        return WebClient.builder()
                        .baseUrl(baseUrl)
                        .exchangeStrategies(ExchangeStrategies.builder()
                                                              .codecs(codecs -> codecs.defaultCodecs()
                                                                                      .maxInMemorySize(
                                                                                              MAX_RESPONSE_BYTES))
                                                              .build())
                        .build();
    }

    @Bean("aiAuthentication")
    public Authentication aiAuthentication() {
        if (headerValue == null || headerValue.isBlank()) {
            log.warn("AI inference API key is not configured. Calls may fail authentication.");
        }
        return new APIKeyAuthentication(headerName, headerValue);
    }
}
