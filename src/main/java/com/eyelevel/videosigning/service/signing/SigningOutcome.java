package com.eyelevel.videosigning.service.signing;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The classified result of one signer invocation. Each variant carries only the fields that
 * apply to it.
 */
public sealed interface SigningOutcome {

    int MAX_DETAIL_DIAGNOSTICS = 2000;

    /**
     * @return A human-readable failure cause for the job record, or {@code null} on success.
     */
    String errorDetail();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * The signer exited with code 0.
     */
    record Success(Path outputPath, String stdout, String stderr) implements SigningOutcome {
        @Override
        public String errorDetail() {
            return null;
        }
    }

    /**
     * The signer ran to completion with a non-zero exit code.
     */
    record SignerFailure(int exitCode, String stdout, String stderr) implements SigningOutcome {
        @Override
        public String errorDetail() {
            String diagnostics = !stderr.isBlank() ? stderr : stdout;
            if (diagnostics.isBlank()) {
                return "Signing failed with exit code " + exitCode;
            }
            if (diagnostics.length() > MAX_DETAIL_DIAGNOSTICS) {
                diagnostics = diagnostics.substring(diagnostics.length() - MAX_DETAIL_DIAGNOSTICS);
            }
            return "Signing failed with exit code " + exitCode + ": " + diagnostics;
        }
    }

    /**
     * The signer was still running when the timeout elapsed and was killed.
     */
    record Timeout(Duration timeout) implements SigningOutcome {
        @Override
        public String errorDetail() {
            return "Signing process timed out after " + timeout.toSeconds() + " seconds";
        }
    }

    /**
     * The signer could not be started or communicated with at all.
     */
    record InvocationError(String message) implements SigningOutcome {
        @Override
        public String errorDetail() {
            return "Signing process could not be started: " + message;
        }
    }
}
