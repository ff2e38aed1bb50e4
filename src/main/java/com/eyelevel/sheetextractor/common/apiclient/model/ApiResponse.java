package com.eyelevel.sheetextractor.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents a successful (2xx) response from an external API call.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The raw response body. May be null when the response has no body.
     */
    @Nullable
    private final byte[] data;

    @Nullable
    private final MediaType contentType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    private final Instant timestamp;
}
