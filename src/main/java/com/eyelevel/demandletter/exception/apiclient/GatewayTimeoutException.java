package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a downstream service did not answer in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7751386690215347721L;

    /**
     * Constructs a new GatewayTimeoutException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
