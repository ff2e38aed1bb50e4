package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The operation is not allowed in the current state, e.g. a second active job or canceling a finished one (409).
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5518230971226049513L;

    public ConflictException(String message) {
        super(message, 409);
    }
}
