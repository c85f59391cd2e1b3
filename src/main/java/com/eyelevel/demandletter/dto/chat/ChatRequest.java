package com.eyelevel.demandletter.dto.chat;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /send_message}.
 */
public record ChatRequest(@NotBlank(message = "Message cannot be empty") String message) {
}
