package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that the remote server failed unexpectedly (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = 391091864299701366L;

    /**
     * Constructs a new InternalServerException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public InternalServerException(String message) {
        super(message, 500);
    }
}
