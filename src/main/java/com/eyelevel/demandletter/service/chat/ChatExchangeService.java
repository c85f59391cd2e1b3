package com.eyelevel.demandletter.service.chat;

import com.eyelevel.demandletter.common.apiclient.webhook.ChatWebhookClient;
import com.eyelevel.demandletter.dto.chat.ChatHistoryItem;
import com.eyelevel.demandletter.exception.ChatDispatchException;
import com.eyelevel.demandletter.exception.apiclient.ApiException;
import com.eyelevel.demandletter.exception.apiclient.BadRequestException;
import com.eyelevel.demandletter.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.demandletter.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Relays a user message to the chat webhook and records the exchange.
 * <p>
 * Unlike document generation this is synchronous: the caller waits for the reply, bounded by the chat
 * client's timeout. The user message is recorded before the call, and its bot response is filled exactly
 * once afterwards, with the reply or with {@link #FALLBACK_RESPONSE}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatExchangeService {

    public static final String FALLBACK_RESPONSE = "Sorry, I couldn't process your message at the moment.";

    private final JobStore jobStore;
    private final ChatWebhookClient chatWebhookClient;

    /**
     * @param message The user's message.
     * @return The webhook's reply.
     * @throws BadRequestException   if the message is blank; nothing is recorded.
     * @throws ChatDispatchException if the webhook fails (502) or times out (504).
     */
    public String sendMessage(final String message) {
        if (message == null || message.isBlank()) {
            throw new BadRequestException("Message cannot be empty");
        }

        final long chatId = jobStore.createChat(message);
        final String reply;
        try {
            reply = chatWebhookClient.sendMessage(message);
        } catch (ApiException e) {
            log.warn("Chat webhook failed for message {}: {}", chatId, e.getMessage());
            jobStore.fillChatResponse(chatId, FALLBACK_RESPONSE);

            final boolean timedOut = e instanceof GatewayTimeoutException;
            throw new ChatDispatchException(
                    timedOut ? "Chat service did not respond in time" : "Chat service unavailable: " + e.getMessage(),
                    timedOut ? HttpStatus.GATEWAY_TIMEOUT.value() : HttpStatus.BAD_GATEWAY.value(),
                    FALLBACK_RESPONSE, e);
        }

        jobStore.fillChatResponse(chatId, reply);
        log.debug("Chat message {} answered ({} chars).", chatId, reply.length());
        return reply;
    }

    public List<ChatHistoryItem> history() {
        return jobStore.listChats().stream().map(ChatHistoryItem::from).toList();
    }
}
