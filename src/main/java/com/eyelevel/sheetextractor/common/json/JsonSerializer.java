package com.eyelevel.sheetextractor.common.json;

/**
 * Serializes Java objects to JSON text.
 */
public interface JsonSerializer {

    <T> String serialize(T object);
}
