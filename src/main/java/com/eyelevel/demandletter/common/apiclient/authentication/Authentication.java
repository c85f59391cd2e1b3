package com.eyelevel.demandletter.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to a webhook request.
 *
 * <p>This interface allows different authentication schemes to be applied to outgoing requests in a
 * consistent manner.
 */
public interface Authentication {

    /**
     * Applies the authentication to the provided header map.
     *
     * @param authorization A map containing request headers and their values. Implementations
     *                      should add or modify entries in this map to apply the authentication scheme.
     */
    void applyAuthentication(Map<String, String> authorization);
}
