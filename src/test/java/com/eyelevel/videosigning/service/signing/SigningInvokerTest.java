package com.eyelevel.videosigning.service.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.eyelevel.videosigning.common.processexec.ProcessExecutor;
import com.eyelevel.videosigning.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.videosigning.config.VideoSigningConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SigningInvokerTest {

    private static final Path INPUT = Path.of("/tmp/staging/upload-1.mp4");
    private static final Path OUTPUT = Path.of("/tmp/out/clip_signed.mp4");

    @Mock private ProcessExecutor processExecutor;

    private VideoSigningConfig config;
    private SigningInvoker invoker;

    @BeforeEach
    void setUp() {
        config = new VideoSigningConfig();
        config.setSignerExecutable("/opt/signer/bin/signer");
        config.setPrivateKeyPath("/etc/keys/private.pem");
        config.setTimeout(Duration.ofSeconds(5));
        invoker = new SigningInvoker(config, processExecutor);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void sign_exitCodeZeroIsSuccess() throws Exception {
        givenResult(new ProcessResult(0, "signed 42 frames", "", false));

        SigningOutcome outcome = invoker.sign(INPUT, OUTPUT, "Job 1");

        assertThat(outcome).isInstanceOf(SigningOutcome.Success.class);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.errorDetail()).isNull();
        assertThat(((SigningOutcome.Success) outcome).outputPath()).isEqualTo(OUTPUT);
    }

    @Test
    void sign_nonZeroExitIsSignerFailureWithDiagnostics() throws Exception {
        givenResult(new ProcessResult(3, "", "could not load key material", false));

        SigningOutcome outcome = invoker.sign(INPUT, OUTPUT, "Job 1");

        assertThat(outcome).isEqualTo(new SigningOutcome.SignerFailure(3, "", "could not load key material"));
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.errorDetail()).isEqualTo("Signing failed with exit code 3: could not load key material");
    }

    @Test
    void sign_timeoutIsReportedWithConfiguredDuration() throws Exception {
        givenResult(new ProcessResult(-1, "", "", true));

        SigningOutcome outcome = invoker.sign(INPUT, OUTPUT, "Job 1");

        assertThat(outcome).isEqualTo(new SigningOutcome.Timeout(Duration.ofSeconds(5)));
        assertThat(outcome.errorDetail()).isEqualTo("Signing process timed out after 5 seconds");
    }

    @Test
    void sign_startFailureIsInvocationError() throws Exception {
        when(processExecutor.execute(anyList(), anyMap(), anyString(), any(Duration.class), anyString()))
                .thenThrow(new IOException("Cannot run program \"/opt/signer/bin/signer\""));

        SigningOutcome outcome = invoker.sign(INPUT, OUTPUT, "Job 1");

        assertThat(outcome).isInstanceOf(SigningOutcome.InvocationError.class);
        assertThat(outcome.errorDetail())
                .startsWith("Signing process could not be started: ")
                .contains("Cannot run program");
    }

    @Test
    void sign_interruptionIsInvocationErrorAndKeepsInterruptFlag() throws Exception {
        when(processExecutor.execute(anyList(), anyMap(), anyString(), any(Duration.class), anyString()))
                .thenThrow(new InterruptedException());

        SigningOutcome outcome = invoker.sign(INPUT, OUTPUT, "Job 1");

        assertThat(outcome).isInstanceOf(SigningOutcome.InvocationError.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void sign_passesTimeoutAndPluginPathToExecutor() throws Exception {
        config.setGstPluginPath("/opt/gst/plugins");
        givenResult(new ProcessResult(0, "", "", false));

        invoker.sign(INPUT, OUTPUT, "Job 7");

        verify(processExecutor).execute(eq(invoker.buildCommand(INPUT, OUTPUT)),
                                        eq(Map.of("GST_PLUGIN_PATH", "/opt/gst/plugins")), eq("Job 7"),
                                        eq(Duration.ofSeconds(5)), anyString());
    }

    @Test
    void buildCommand_withoutPassword() {
        assertThat(invoker.buildCommand(INPUT, OUTPUT)).containsExactly(
                "/opt/signer/bin/signer",
                "--input", "/tmp/staging/upload-1.mp4",
                "--output", "/tmp/out/clip_signed.mp4",
                "--key", "/etc/keys/private.pem",
                "--verbose");
    }

    @Test
    void buildCommand_withPasswordAndMasking() {
        config.setPrivateKeyPassword("s3cret");

        List<String> command = invoker.buildCommand(INPUT, OUTPUT);

        assertThat(command).containsSubsequence(SigningInvoker.PASSWORD_FLAG, "s3cret", "--verbose");
        assertThat(SigningInvoker.maskPassword(command))
                .doesNotContain("s3cret")
                .containsSubsequence(SigningInvoker.PASSWORD_FLAG, "******");
        assertThat(command).contains("s3cret");
    }

    private void givenResult(ProcessResult result) throws Exception {
        when(processExecutor.execute(anyList(), anyMap(), anyString(), any(Duration.class), anyString()))
                .thenReturn(result);
    }
}
