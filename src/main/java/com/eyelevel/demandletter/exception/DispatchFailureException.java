package com.eyelevel.demandletter.exception;

import java.io.Serial;

/**
 * Signals that the document-generation webhook answered, but not with a usable document.
 * <p>
 * Never reaches an HTTP caller: the dispatcher records the message as the job's failure reason.
 */
public class DispatchFailureException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public DispatchFailureException(String message) {
        super(message);
    }
}
