package com.eyelevel.sheetextractor.common.apiclient.authentication;

import java.util.Map;

/**
 * Defines the contract for applying authentication to an API request.
 */
public interface Authentication {

    /**
     * Adds the scheme's credentials to the outgoing request headers.
     *
     * @param headers The mutable header map of the request.
     */
    void applyAuthentication(Map<String, String> headers);
}
