package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is unavailable or could not be reached (503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8042318837426097311L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
