package com.eyelevel.batchorchestrator.common.json.jackson;

import com.eyelevel.batchorchestrator.common.json.JsonParser;
import com.eyelevel.batchorchestrator.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's Jackson
 * {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        if (json == null) {
            throw new JsonParsingException("Cannot parse a null JSON string into " + valueType.getSimpleName(), null);
        }
        return parseObject(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty body into " + valueType.getSimpleName(), null);
        }
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON byte array to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON byte array", e);
        }
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, TypeReference<T> valueType) {
        log.debug("Parsing JSON byte array to type: {}", valueType.getType());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty body into " + valueType.getType(), null);
        }
        try {
            return objectMapper.readValue(jsonBytes, valueType);
        } catch (IOException e) {
            log.error("Error parsing JSON byte array to type: {}", valueType.getType(), e);
            throw new JsonParsingException("Error parsing JSON byte array", e);
        }
    }
}
