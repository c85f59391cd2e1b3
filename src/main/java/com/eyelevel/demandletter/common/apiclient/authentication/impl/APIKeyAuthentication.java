package com.eyelevel.demandletter.common.apiclient.authentication.impl;

import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * An implementation of {@link Authentication} that injects a static API key into request headers,
 * for webhooks protected by a header-based secret.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    /**
     * Adds a header with the configured name and key.
     *
     * @param authorization A non-null map of headers to which the API key will be added.
     */
    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        if (authorization == null) {
            log.error("Authorization map cannot be null when applying API key authentication.");
            return;
        }

        log.debug("Applying API key authentication using header: '{}'", headerName);
        try {
            authorization.put(headerName, apiKey);
        } catch (UnsupportedOperationException e) {
            log.error("Cannot apply API key authentication. The provided authorization map is immutable.", e);
            throw e;
        }
    }
}
