package com.eyelevel.sheetextractor.common.json;

import java.util.Map;

/**
 * Parses JSON text into Java objects.
 */
public interface JsonParser {

    <T> T parseObject(String json, Class<T> valueType);

    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON document that must be an object at the top level.
     *
     * @param json The JSON text.
     * @return The object as an insertion-ordered map.
     */
    Map<String, Object> parseMap(String json);
}
