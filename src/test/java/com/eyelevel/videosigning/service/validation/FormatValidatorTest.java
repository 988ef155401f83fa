package com.eyelevel.videosigning.service.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class FormatValidatorTest {

    private FormatValidator validator;

    @BeforeEach
    void setUp() {
        validator = new FormatValidator(new VideoSigningConfig());
    }

    @ParameterizedTest
    @ValueSource(strings = {"clip.mp4", "clip.mov", "clip.avi", "clip.mkv", "clip.m4v"})
    void isSupported_acceptsConfiguredExtensions(String fileName) {
        assertThat(validator.isSupported(fileName)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"CLIP.MP4", "clip.Mov", "holiday.final.MKV", "/sdcard/DCIM/clip.mp4"})
    void isSupported_ignoresCaseAndPath(String fileName) {
        assertThat(validator.isSupported(fileName)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"notes.txt", "clip.mp4.txt", "clip", "clip.", "mp4", "  "})
    void isSupported_rejectsOtherNames(String fileName) {
        assertThat(validator.isSupported(fileName)).isFalse();
    }

    @Test
    void supportedFormats_areReportedWithLeadingDot() {
        assertThat(validator.supportedFormats())
                .containsExactlyInAnyOrder(".mp4", ".mov", ".avi", ".mkv", ".m4v");
    }

    @Test
    void configuredEntriesMayCarryDotsAndMixedCase() {
        VideoSigningConfig config = new VideoSigningConfig();
        config.setSupportedFormats(Set.of(".MP4", " webm "));
        FormatValidator custom = new FormatValidator(config);

        assertThat(custom.isSupported("clip.mp4")).isTrue();
        assertThat(custom.isSupported("clip.WEBM")).isTrue();
        assertThat(custom.isSupported("clip.mov")).isFalse();
        assertThat(custom.supportedFormats()).containsExactly(".mp4", ".webm");
    }
}
