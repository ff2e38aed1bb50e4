package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is rate limiting this client (429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3170846523096213518L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
