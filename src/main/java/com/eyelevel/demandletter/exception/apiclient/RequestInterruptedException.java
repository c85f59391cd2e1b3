package com.eyelevel.demandletter.exception.apiclient;

import java.io.Serial;

/**
 * Thrown when the thread waiting for a downstream response is interrupted, typically because the
 * application is shutting down. The call's outcome is unknown, not failed. The thread's interrupt
 * flag is set again before this is thrown.
 */
public class RequestInterruptedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2290475164312087715L;

    public RequestInterruptedException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
