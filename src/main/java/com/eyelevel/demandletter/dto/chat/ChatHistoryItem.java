package com.eyelevel.demandletter.dto.chat;

import com.eyelevel.demandletter.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * One recorded exchange in the chat history view. {@code bot_response} is null while the webhook call
 * is still in flight.
 */
public record ChatHistoryItem(
        Long id,
        @JsonProperty("user_message") String userMessage,
        @JsonProperty("bot_response") String botResponse,
        LocalDateTime timestamp) {

    public static ChatHistoryItem from(ChatMessage message) {
        return new ChatHistoryItem(message.getId(), message.getUserMessage(), message.getBotResponse(),
                message.getTimestamp());
    }
}
