package com.eyelevel.videosigning.common.json.jackson;

import com.eyelevel.videosigning.common.json.JsonParser;
import com.eyelevel.videosigning.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        if (json == null) {
            throw new JsonParsingException("Cannot parse null JSON input", null);
        }
        try {
            T result = objectMapper.readValue(json.getBytes(StandardCharsets.UTF_8), valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.debug("Error parsing JSON string to object of type: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON string", e);
        }
    }
}
