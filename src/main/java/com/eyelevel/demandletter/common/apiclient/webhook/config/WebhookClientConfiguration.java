package com.eyelevel.demandletter.common.apiclient.webhook.config;

import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;
import com.eyelevel.demandletter.common.apiclient.authentication.impl.APIKeyAuthentication;
import com.eyelevel.demandletter.common.apiclient.authentication.impl.NoAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} instances and the {@link Authentication} used to reach the
 * document-generation and chat webhooks.
 */
@Slf4j
@Configuration
public class WebhookClientConfiguration {

    @Value("${app.webhook.document.base-url}")
    private String documentBaseUrl;

    @Value("${app.webhook.chat.base-url}")
    private String chatBaseUrl;

    @Value("${app.webhook.max-response-size:50MB}")
    private DataSize maxResponseSize;

    @Value("${app.webhook.auth-key-name:}")
    private String headerName;

    @Value("${app.webhook.auth-key-value:}")
    private String headerValue;

    /**
     * The client for the document-generation webhook. Its in-memory buffer is raised so that whole
     * generated documents can be read into a single byte array.
     */
    @Bean("documentWebhookWebClient")
    public WebClient documentWebhookWebClient(final WebClient.Builder builder) {
        log.info("Initializing document webhook WebClient with base URL: {}", documentBaseUrl);
        return builder.clone()
                .baseUrl(documentBaseUrl)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) maxResponseSize.toBytes()))
                .build();
    }

    @Bean("chatWebhookWebClient")
    public WebClient chatWebhookWebClient(final WebClient.Builder builder) {
        log.info("Initializing chat webhook WebClient with base URL: {}", chatBaseUrl);
        return builder.clone()
                .baseUrl(chatBaseUrl)
                .build();
    }

    /**
     * Uses API key authentication when a key is configured, otherwise sends anonymous requests.
     */
    @Bean("webhookAuthentication")
    public Authentication webhookAuthentication() {
        if (!StringUtils.hasText(headerName) || !StringUtils.hasText(headerValue)) {
            log.info("No webhook API key configured. Webhook calls are sent without authentication.");
            return new NoAuthentication();
        }
        log.info("Initializing webhook authentication with header name: '{}'", headerName);
        return new APIKeyAuthentication(headerName, headerValue);
    }
}
