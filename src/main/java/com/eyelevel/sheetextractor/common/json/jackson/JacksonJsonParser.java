package com.eyelevel.sheetextractor.common.json.jackson;

import com.eyelevel.sheetextractor.common.json.JsonParser;
import com.eyelevel.sheetextractor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws JsonParsingException if an error occurs during JSON parsing.
     */
    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    /**
     * Parses a JSON object into an ordered map. A top-level array, scalar or {@code null} is rejected.
     *
     * @throws JsonParsingException if the text is not a JSON object.
     */
    @Override
    public Map<String, Object> parseMap(String json) {
        if (json == null) {
            throw new JsonParsingException("Expected a JSON object but got no content", null);
        }
        try {
            final Map<String, Object> result = objectMapper.readValue(json, MAP_TYPE);
            if (result == null) {
                throw new JsonParsingException("Expected a JSON object but got null", null);
            }
            return result;
        } catch (IOException e) {
            log.debug("Content is not a JSON object: {}", e.getMessage());
            throw new JsonParsingException("Expected a JSON object", e);
        }
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("parsing was successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON with Class " + valueType.getSimpleName(), e);
        }
    }
}
