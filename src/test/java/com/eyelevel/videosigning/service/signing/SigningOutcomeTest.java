package com.eyelevel.videosigning.service.signing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SigningOutcomeTest {

    @Test
    void signerFailure_fallsBackToStdoutWhenStderrIsBlank() {
        var failure = new SigningOutcome.SignerFailure(2, "bad container", " ");

        assertThat(failure.errorDetail()).isEqualTo("Signing failed with exit code 2: bad container");
    }

    @Test
    void signerFailure_withoutDiagnosticsNamesOnlyTheExitCode() {
        var failure = new SigningOutcome.SignerFailure(139, "", "");

        assertThat(failure.errorDetail()).isEqualTo("Signing failed with exit code 139");
    }

    @Test
    void signerFailure_keepsTheTailOfLongDiagnostics() {
        String stderr = "a".repeat(5_000) + "final error line";
        var failure = new SigningOutcome.SignerFailure(1, "", stderr);

        String detail = failure.errorDetail();

        assertThat(detail)
                .startsWith("Signing failed with exit code 1: ")
                .endsWith("final error line")
                .hasSize("Signing failed with exit code 1: ".length() + SigningOutcome.MAX_DETAIL_DIAGNOSTICS);
    }
}
