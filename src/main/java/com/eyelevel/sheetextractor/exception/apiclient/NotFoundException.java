package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The requested job, document or extraction does not exist (404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2871450920931781634L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
