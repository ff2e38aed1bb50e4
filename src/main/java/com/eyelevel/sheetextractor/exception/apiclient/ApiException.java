package com.eyelevel.sheetextractor.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for status-coded errors, raised both by the orchestrator towards its callers and by the
 * outbound API client when a remote service answers with an error status.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 6194472251380147720L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
