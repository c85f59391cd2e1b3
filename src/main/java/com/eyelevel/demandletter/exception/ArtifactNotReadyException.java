package com.eyelevel.demandletter.exception;

import com.eyelevel.demandletter.exception.apiclient.ConflictException;

import java.io.Serial;

/**
 * Thrown when a download is requested for a job that is still {@code processing}.
 */
public class ArtifactNotReadyException extends ConflictException {

    @Serial
    private static final long serialVersionUID = 6172390437785512219L;

    public ArtifactNotReadyException(String message) {
        super(message);
    }
}
