package com.eyelevel.demandletter.exception;

import com.eyelevel.demandletter.exception.apiclient.NotFoundException;

import java.io.Serial;

/**
 * Thrown when a status or download query names a job that does not exist, or, for downloads,
 * a job that failed and therefore has no artifact.
 */
public class JobNotFoundException extends NotFoundException {

    @Serial
    private static final long serialVersionUID = -2408765823019835730L;

    public JobNotFoundException(String message) {
        super(message);
    }
}
