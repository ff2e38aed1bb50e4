package com.eyelevel.sheetextractor.common.apiclient.authentication.impl;

import com.eyelevel.sheetextractor.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Sends a static API key in a configurable header. For bearer-token services the header is
 * {@code Authorization} and the value carries the {@code Bearer } prefix.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (headers == null) {
            log.error("Header map cannot be null when applying API key authentication.");
            return;
        }
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("No API key configured. Sending request without '{}' header.", headerName);
            return;
        }
        log.debug("Applying API key authentication using header: '{}'", headerName);
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + "]";
    }
}
