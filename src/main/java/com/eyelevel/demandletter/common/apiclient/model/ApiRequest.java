package com.eyelevel.demandletter.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to an external webhook.
 *
 * <p>Encapsulates the HTTP method, path, headers, body and response deadline of a call made through
 * {@link com.eyelevel.demandletter.common.apiclient.ApiClient}.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * The path of the endpoint, relative to the client's base URL.
     */
    private final String path;

    /**
     * The headers for the request. Authentication headers are added to this map before sending.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The body of the request, or null when there is none.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    /**
     * The content type of the request body. Defaults to JSON when a body is present.
     */
    @Nullable
    private final MediaType contentType;

    /**
     * How long to wait for the complete response. A null timeout waits indefinitely.
     */
    @Nullable
    private final Duration timeout;
}
