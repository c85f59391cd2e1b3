package com.eyelevel.demandletter.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

/**
 * Represents a successful (2xx) response from an external webhook.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The raw response body; empty, never null, when the webhook sent no body.
     */
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    private final int statusCode;

    public boolean hasData() {
        return data != null && data.length > 0;
    }
}
