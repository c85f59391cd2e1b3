package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a downstream service could not be reached (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -8329017364211894512L;

    /**
     * Constructs a new ServiceUnavailableException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
