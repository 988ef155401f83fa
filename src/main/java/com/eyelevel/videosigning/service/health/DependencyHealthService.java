package com.eyelevel.videosigning.service.health;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import com.eyelevel.videosigning.dto.health.HealthReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDateTime;

/**
 * Reports whether the signer's external dependencies are present on disk. Each dependency is
 * checked independently and the check itself never fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyHealthService {

    private final VideoSigningConfig config;

    public HealthReport healthCheck() {
        final HealthReport.Dependencies dependencies = new HealthReport.Dependencies(
                exists(config.getSignedVideoLibPath()),
                exists(config.getSignerExecutable()),
                exists(config.getPrivateKeyPath()));
        return new HealthReport("healthy", LocalDateTime.now(), dependencies);
    }

    static boolean exists(final String path) {
        if (!StringUtils.hasText(path)) {
            return false;
        }
        try {
            return Files.exists(Paths.get(path));
        } catch (RuntimeException e) {
            log.debug("Could not check dependency path '{}': {}", path, e.getMessage());
            return false;
        }
    }
}
