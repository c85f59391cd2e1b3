package com.eyelevel.demandletter.common.apiclient.webhook;

import com.eyelevel.demandletter.common.apiclient.ApiClient;
import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;
import com.eyelevel.demandletter.common.apiclient.model.ApiRequest;
import com.eyelevel.demandletter.common.apiclient.model.ApiResponse;
import com.eyelevel.demandletter.exception.apiclient.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Client for the chat webhook. Calls block the caller for at most the configured timeout.
 */
@Slf4j
@Service
public class ChatWebhookClient extends ApiClient {

    @Value("${app.webhook.chat.path}")
    private String chatPath;

    @Value("${app.webhook.chat.timeout:60s}")
    private Duration timeout;

    public ChatWebhookClient(
            @Qualifier("chatWebhookWebClient") final WebClient webClient,
            @Qualifier("webhookAuthentication") final Authentication authentication) {
        super(webClient, authentication);
    }

    /**
     * Posts {@code {"message": ...}} and returns the reply body as text.
     *
     * @param message The user's message.
     * @return The webhook's reply, decoded as UTF-8.
     * @throws ApiException if the webhook fails, answers non-2xx, or exceeds the timeout.
     */
    public String sendMessage(final String message) {
        final ApiResponse response = call(ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(chatPath)
                .body(Map.of("message", message))
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.ALL)
                .timeout(timeout)
                .build());
        return new String(response.getData(), StandardCharsets.UTF_8);
    }
}
