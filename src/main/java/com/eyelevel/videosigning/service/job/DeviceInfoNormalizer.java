package com.eyelevel.videosigning.service.job;

import com.eyelevel.videosigning.common.json.JsonParser;
import com.eyelevel.videosigning.common.json.JsonSerializer;
import com.eyelevel.videosigning.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns the optional device metadata sent with an upload into compact JSON for storage.
 * Metadata that is not a JSON object is logged and dropped; it never fails a submission.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceInfoNormalizer {

    private final JsonParser jsonParser;
    private final JsonSerializer jsonSerializer;

    /**
     * @param rawDeviceInfo Client-supplied metadata text, possibly null or blank.
     * @return Compact JSON text of the metadata object, or {@code null} if absent or malformed.
     */
    public String normalize(final String rawDeviceInfo) {
        if (!StringUtils.hasText(rawDeviceInfo)) {
            return null;
        }
        try {
            final JsonNode node = jsonParser.parseObject(rawDeviceInfo, JsonNode.class);
            if (node == null || !node.isObject()) {
                log.warn("Ignoring device_info that is not a JSON object.");
                return null;
            }
            return jsonSerializer.serialize(node);
        } catch (JsonParsingException e) {
            log.warn("Invalid device_info JSON provided; treating it as absent. Cause: {}",
                     e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return null;
        }
    }
}
