package com.eyelevel.batchorchestrator.common.json;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Defines the contract for parsing JSON data into Java objects.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @throws com.eyelevel.batchorchestrator.exception.json.JsonParsingException if the data is not
     *                                                                            valid JSON for the type.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws com.eyelevel.batchorchestrator.exception.json.JsonParsingException if the data is not
     *                                                                            valid JSON for the type.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a generic type such as a list of DTOs.
     */
    <T> T parseObject(byte[] jsonBytes, TypeReference<T> valueType);
}
