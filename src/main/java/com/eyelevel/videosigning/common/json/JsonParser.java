package com.eyelevel.videosigning.common.json;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Implementations handle the details of JSON parsing using a specific JSON library.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.videosigning.exception.json.JsonParsingException if the input is not valid JSON.
     */
    <T> T parseObject(String json, Class<T> valueType);
}
