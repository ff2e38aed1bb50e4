package com.eyelevel.sheetextractor.exception.apiclient;

import java.io.Serial;

/**
 * The remote service or the client-side timeout expired before a response arrived (504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5531307709826417862L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
