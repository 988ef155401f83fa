package com.eyelevel.videosigning.service.validation;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A stateless check of submitted filenames against the configured set of video extensions.
 */
@Slf4j
@Service
public class FormatValidator {

    private final Set<String> supportedExtensions;

    public FormatValidator(final VideoSigningConfig config) {
        this.supportedExtensions = Collections.unmodifiableSet(config.getSupportedFormats().stream()
                .filter(StringUtils::hasText)
                .map(FormatValidator::normalize)
                .collect(Collectors.<String, TreeSet<String>>toCollection(TreeSet::new)));
        log.info("Accepting video formats: {}", supportedFormats());
    }

    /**
     * Checks whether the file's extension is accepted. The comparison ignores case.
     *
     * @param fileName The client-supplied filename, which may include path information.
     * @return {@code true} if the extension is in the accepted set, {@code false} otherwise,
     *         including for names without an extension.
     */
    public boolean isSupported(final String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return false;
        }
        final String extension = FilenameUtils.getExtension(fileName);
        if (!StringUtils.hasText(extension)) {
            return false;
        }
        final boolean supported = supportedExtensions.contains(normalize(extension));
        log.trace("Checking support for '{}': {}", fileName, supported);
        return supported;
    }

    /**
     * @return The accepted extensions in ".ext" form, for error messages.
     */
    public Set<String> supportedFormats() {
        return supportedExtensions.stream().map(ext -> "." + ext)
                                  .collect(Collectors.toCollection(TreeSet::new));
    }

    private static String normalize(final String extension) {
        final String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed.substring(1) : trimmed;
    }
}
