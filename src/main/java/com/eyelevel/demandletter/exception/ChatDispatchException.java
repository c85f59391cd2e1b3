package com.eyelevel.demandletter.exception;

import com.eyelevel.demandletter.exception.apiclient.ApiException;
import lombok.Getter;

import java.io.Serial;

/**
 * Raised synchronously to the chat caller when the chat webhook fails or times out.
 * Carries the placeholder reply that was persisted for the exchange.
 */
@Getter
public class ChatDispatchException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1460731928653371884L;

    private final String fallbackResponse;

    public ChatDispatchException(String message, int statusCode, String fallbackResponse, Throwable cause) {
        super(message, statusCode, cause);
        this.fallbackResponse = fallbackResponse;
    }
}
