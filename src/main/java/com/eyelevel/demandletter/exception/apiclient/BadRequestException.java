package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the request was malformed or invalid (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6480916225830409913L;

    /**
     * Constructs a new BadRequestException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public BadRequestException(String message) {
        super(message, 400);
    }
}
