package com.eyelevel.sheetextractor.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to an external API.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    /**
     * The path (endpoint) relative to the client's base URL.
     */
    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Request headers. Authentication is added to this map before sending.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The body, serialized by the {@code WebClient} codecs according to {@link #contentType}.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    @Nullable
    private final MediaType contentType;
}
