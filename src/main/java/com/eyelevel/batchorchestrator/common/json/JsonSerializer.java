package com.eyelevel.batchorchestrator.common.json;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    <T> String serialize(T object);

    /**
     * @param prettyPrint whether to format the JSON with indentation and line breaks.
     *
     * @throws com.eyelevel.batchorchestrator.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object, boolean prettyPrint);
}
