package com.eyelevel.demandletter.controller;

import com.eyelevel.demandletter.repository.ChatMessageRepository;
import com.eyelevel.demandletter.service.chat.ChatExchangeService;
import com.eyelevel.demandletter.support.WebhookStubSupport;
import com.github.tomakehurst.wiremock.client.WireMock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ChatControllerTest extends WebhookStubSupport {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ChatMessageRepository chatMessageRepository;

    @Test
    void replyIsReturnedAndRecorded() throws Exception {
        WIREMOCK.stubFor(WireMock.post(urlEqualTo(CHAT_PATH))
                .withRequestBody(equalToJson("{\"message\": \"hello\"}"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "text/plain")
                        .withBody("hi there")));

        mockMvc.perform(post("/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"hello\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("hi there"));

        mockMvc.perform(get("/chat/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[-1].user_message").value("hello"))
                .andExpect(jsonPath("$[-1].bot_response").value("hi there"));
    }

    @Test
    void webhookFailureRecordsPlaceholder() throws Exception {
        WIREMOCK.stubFor(WireMock.post(urlEqualTo(CHAT_PATH))
                .willReturn(aResponse().withStatus(500).withBody("workflow error")));

        mockMvc.perform(post("/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"are you there?\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value(startsWith("Chat service unavailable")))
                .andExpect(jsonPath("$.response").value(ChatExchangeService.FALLBACK_RESPONSE));

        mockMvc.perform(get("/chat/history"))
                .andExpect(jsonPath("$[-1].user_message").value("are you there?"))
                .andExpect(jsonPath("$[-1].bot_response").value(ChatExchangeService.FALLBACK_RESPONSE));
    }

    @Test
    void slowWebhookTimesOut() throws Exception {
        WIREMOCK.stubFor(WireMock.post(urlEqualTo(CHAT_PATH))
                .willReturn(aResponse().withStatus(200).withBody("too late").withFixedDelay(3000)));

        mockMvc.perform(post("/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"slow\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.response").value(ChatExchangeService.FALLBACK_RESPONSE));
    }

    @Test
    void blankMessageIsRejectedWithoutRecording() throws Exception {
        long before = chatMessageRepository.count();

        mockMvc.perform(post("/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message cannot be empty"));

        mockMvc.perform(post("/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        assertEquals(before, chatMessageRepository.count());
        WIREMOCK.verify(0, postRequestedFor(urlEqualTo(CHAT_PATH)));
    }
}
