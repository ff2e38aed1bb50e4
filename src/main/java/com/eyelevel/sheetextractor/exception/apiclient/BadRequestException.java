package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The request could not be built or was rejected as malformed (400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1408224339184721707L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
