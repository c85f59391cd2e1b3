package com.eyelevel.demandletter.service.chat;

import com.eyelevel.demandletter.common.apiclient.webhook.ChatWebhookClient;
import com.eyelevel.demandletter.exception.ChatDispatchException;
import com.eyelevel.demandletter.exception.apiclient.BadRequestException;
import com.eyelevel.demandletter.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.demandletter.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.demandletter.service.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChatExchangeServiceTest {

    private JobStore jobStore;
    private ChatWebhookClient chatWebhookClient;
    private ChatExchangeService service;

    @BeforeEach
    void setUp() {
        jobStore = mock(JobStore.class);
        chatWebhookClient = mock(ChatWebhookClient.class);
        service = new ChatExchangeService(jobStore, chatWebhookClient);
        when(jobStore.createChat(anyString())).thenReturn(11L);
    }

    @Test
    void messageIsRecordedBeforeCallAndReplyFilledAfter() {
        when(chatWebhookClient.sendMessage("hello")).thenReturn("hi there");

        assertEquals("hi there", service.sendMessage("hello"));

        InOrder order = inOrder(jobStore, chatWebhookClient);
        order.verify(jobStore).createChat("hello");
        order.verify(chatWebhookClient).sendMessage("hello");
        order.verify(jobStore).fillChatResponse(11L, "hi there");
    }

    @Test
    void blankMessageTouchesNothing() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> service.sendMessage(" \t"));
        assertEquals("Message cannot be empty", ex.getMessage());
        verifyNoInteractions(jobStore, chatWebhookClient);
    }

    @Test
    void unreachableWebhookIsBadGatewayWithPlaceholder() {
        when(chatWebhookClient.sendMessage("ping"))
                .thenThrow(new ServiceUnavailableException("Failed to connect to external service"));

        ChatDispatchException ex = assertThrows(ChatDispatchException.class, () -> service.sendMessage("ping"));

        assertEquals(502, ex.getStatusCode());
        assertEquals(ChatExchangeService.FALLBACK_RESPONSE, ex.getFallbackResponse());
        verify(jobStore).fillChatResponse(11L, ChatExchangeService.FALLBACK_RESPONSE);
    }

    @Test
    void timeoutIsGatewayTimeout() {
        when(chatWebhookClient.sendMessage("slow")).thenThrow(new GatewayTimeoutException("Request timed out"));

        ChatDispatchException ex = assertThrows(ChatDispatchException.class, () -> service.sendMessage("slow"));

        assertEquals(504, ex.getStatusCode());
        assertInstanceOf(GatewayTimeoutException.class, ex.getCause());
        verify(jobStore).fillChatResponse(11L, ChatExchangeService.FALLBACK_RESPONSE);
    }
}
