package com.eyelevel.videosigning.dto.health;

import java.time.LocalDateTime;

/**
 * Diagnostic report of the signing dependencies. Always returned with HTTP 200.
 */
public record HealthReport(String status, LocalDateTime timestamp, Dependencies dependencies) {

    /**
     * @param signedVideoLib   Whether the signed video framework library exists.
     * @param signerExecutable Whether the signing tool exists.
     * @param privateKey       Whether the private key file exists.
     */
    public record Dependencies(boolean signedVideoLib, boolean signerExecutable, boolean privateKey) {
    }
}
