package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a downstream gateway returned an invalid response (HTTP 502).
 */
public class BadGatewayException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2170943127339462351L;

    /**
     * Constructs a new BadGatewayException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public BadGatewayException(String message) {
        super(message, 502);
    }
}
