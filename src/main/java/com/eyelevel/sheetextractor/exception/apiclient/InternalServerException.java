package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service failed while handling the request (500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7795183206521359940L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
