package com.eyelevel.demandletter.support;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;

/**
 * Boots the application against one WireMock server standing in for both webhooks.
 * The server is shared by every test class so the Spring context can be cached.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class WebhookStubSupport {

    protected static final String DOCUMENT_PATH = "/webhook/generate";
    protected static final String CHAT_PATH = "/webhook/chat";
    protected static final String DOCX_MEDIA_TYPE =
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    protected static final WireMockServer WIREMOCK = new WireMockServer(wireMockConfig().dynamicPort());

    static {
        WIREMOCK.start();
        Runtime.getRuntime().addShutdownHook(new Thread(WIREMOCK::stop));
    }

    @DynamicPropertySource
    static void webhookProperties(DynamicPropertyRegistry registry) {
        registry.add("app.webhook.document.base-url", WIREMOCK::baseUrl);
        registry.add("app.webhook.document.path", () -> DOCUMENT_PATH);
        registry.add("app.webhook.chat.base-url", WIREMOCK::baseUrl);
        registry.add("app.webhook.chat.path", () -> CHAT_PATH);
    }

    @BeforeEach
    void resetWebhookStubs() {
        WIREMOCK.resetAll();
    }
}
