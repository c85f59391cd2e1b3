package com.eyelevel.demandletter.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The body of every error answer.
 *
 * @param error    A human-readable description of what went wrong.
 * @param response The placeholder reply persisted for a failed chat exchange; absent otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String response) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
