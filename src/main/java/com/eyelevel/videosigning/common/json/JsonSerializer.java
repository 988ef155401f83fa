package com.eyelevel.videosigning.common.json;

/**
 * Defines the contract for serializing Java objects to JSON text.
 */
public interface JsonSerializer {

    /**
     * @throws com.eyelevel.videosigning.exception.json.JsonParsingException if the object cannot be serialized.
     */
    <T> String serialize(T object);
}
