package com.eyelevel.demandletter.exception;

import com.eyelevel.demandletter.exception.apiclient.BadRequestException;

import java.io.Serial;

/**
 * Thrown when an upload is rejected before any job is created: a missing part, a blank filename,
 * an extension outside the whitelist, an empty or oversized payload, or content that is not UTF-8 text.
 */
public class UploadValidationException extends BadRequestException {

    @Serial
    private static final long serialVersionUID = 1938226054737302468L;

    public UploadValidationException(String message) {
        super(message);
    }
}
