package com.eyelevel.demandletter.common.apiclient.authentication.impl;

import com.eyelevel.demandletter.common.apiclient.authentication.Authentication;

import java.util.Map;

/**
 * Used for webhooks that accept anonymous requests.
 */
public record NoAuthentication() implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> authorization) {
        // anonymous
    }
}
