package com.eyelevel.videosigning.service.health;

import com.eyelevel.videosigning.common.processexec.ProcessExecutor;
import com.eyelevel.videosigning.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.videosigning.config.VideoSigningConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks at startup that the signing dependencies are installed and that the signer runs.
 * Problems are logged; startup is never aborted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignerDependencyValidator {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    private final VideoSigningConfig config;
    private final ProcessExecutor processExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void validateOnStartup() {
        if (!config.isStartupProbeEnabled()) {
            log.info("Signer dependency validation is disabled.");
            return;
        }
        validateDependencies();
        probeSigner();
    }

    /**
     * @return Descriptions of the missing dependencies; empty when all are present.
     */
    List<String> validateDependencies() {
        final List<String> missing = new ArrayList<>();
        if (!DependencyHealthService.exists(config.getSignedVideoLibPath())) {
            missing.add("Signed video library: " + config.getSignedVideoLibPath());
        }
        if (!DependencyHealthService.exists(config.getSignerExecutable())) {
            missing.add("Signer executable: " + config.getSignerExecutable());
        }
        if (!DependencyHealthService.exists(config.getPrivateKeyPath())) {
            missing.add("Private key: " + config.getPrivateKeyPath());
        }

        if (missing.isEmpty()) {
            log.info("All signing dependencies found.");
        } else {
            log.error("Missing signing dependencies:");
            missing.forEach(dependency -> log.error("  - {}", dependency));
            log.error("Please ensure the signed video framework and its signer are installed.");
        }
        return missing;
    }

    void probeSigner() {
        try {
            final ProcessResult result = processExecutor.execute(List.of(config.getSignerExecutable(), "--help"),
                                                                 Map.of(), "startup", PROBE_TIMEOUT, "signer-probe");
            if (result.timedOut()) {
                log.warn("Signer executable did not answer --help within {}s.", PROBE_TIMEOUT.toSeconds());
            } else if (result.exitCode() == 0) {
                log.info("Signer executable is working correctly.");
            } else {
                log.warn("Signer executable returned code {} for --help.", result.exitCode());
            }
        } catch (IOException e) {
            log.error("Failed to test signer executable: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while testing signer executable.");
        }
    }
}
