package com.eyelevel.demandletter.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for exceptions that carry an HTTP status code.
 *
 * <p>Raised both by the webhook clients, where the status mirrors the downstream response, and by the
 * request-handling services, where it is the status returned to the caller.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Constructs a new ApiException wrapping a lower-level cause.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     * @param cause      The underlying failure.
     */
    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
