package com.eyelevel.sheetextractor.exception.json;

import java.io.Serial;

/**
 * Thrown when an attempt to parse or serialize JSON data fails.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2279071460932518446L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
