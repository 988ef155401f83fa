package com.eyelevel.videosigning.service.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.eyelevel.videosigning.common.json.jackson.JacksonJsonParser;
import com.eyelevel.videosigning.common.json.jackson.JacksonJsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class DeviceInfoNormalizerTest {

    private DeviceInfoNormalizer normalizer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        normalizer = new DeviceInfoNormalizer(new JacksonJsonParser(objectMapper),
                                              new JacksonJsonSerializer(objectMapper));
    }

    @Test
    void normalize_compactsJsonObject() {
        String normalized = normalizer.normalize("{ \"os\" : \"android\",\n \"model\": \"Pixel 8\" }");

        assertThat(normalized).isEqualTo("{\"os\":\"android\",\"model\":\"Pixel 8\"}");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not json", "{\"os\":", "[1,2,3]", "\"a string\"", "42"})
    void normalize_dropsAbsentOrNonObjectMetadata(String raw) {
        assertThat(normalizer.normalize(raw)).isNull();
    }
}
