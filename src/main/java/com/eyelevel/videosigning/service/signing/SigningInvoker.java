package com.eyelevel.videosigning.service.signing;

import com.eyelevel.videosigning.common.processexec.ProcessExecutor;
import com.eyelevel.videosigning.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.videosigning.config.VideoSigningConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the external signing tool against a staged video and classifies the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SigningInvoker {

    static final String PASSWORD_FLAG = "--key-password";
    private static final String MASK = "******";
    private static final String PROCESS_NAME = "signer";

    private final VideoSigningConfig config;
    private final ProcessExecutor processExecutor;

    /**
     * Signs {@code input} into {@code output}, waiting at most the configured timeout.
     *
     * @param input       The staged video to sign.
     * @param output      Where the signer should write the signed video.
     * @param contextInfo Logging context, e.g. "Job 42".
     * @return Exactly one {@link SigningOutcome} variant; this method does not throw.
     */
    public SigningOutcome sign(final Path input, final Path output, final String contextInfo) {
        final List<String> command = buildCommand(input, output);
        log.info("[{}] Executing signing command: {}", contextInfo, String.join(" ", maskPassword(command)));

        final ProcessResult result;
        try {
            result = processExecutor.execute(command, buildEnvironment(), contextInfo, config.getTimeout(),
                                             PROCESS_NAME);
        } catch (IOException e) {
            log.error("[{}] Could not start signer '{}': {}", contextInfo, config.getSignerExecutable(),
                      e.getMessage());
            return new SigningOutcome.InvocationError(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[{}] Interrupted while waiting for the signer.", contextInfo);
            return new SigningOutcome.InvocationError("interrupted while waiting for the signer");
        }

        if (result.timedOut()) {
            log.error("[{}] Signer timed out after {}s.", contextInfo, config.getTimeout().toSeconds());
            return new SigningOutcome.Timeout(config.getTimeout());
        }
        if (result.exitCode() != 0) {
            log.error("[{}] Signer exited with code {}.", contextInfo, result.exitCode());
            return new SigningOutcome.SignerFailure(result.exitCode(), result.stdout(), result.stderr());
        }
        log.info("[{}] Signer finished successfully. Output: {}", contextInfo, output);
        return new SigningOutcome.Success(output, result.stdout(), result.stderr());
    }

    List<String> buildCommand(final Path input, final Path output) {
        final List<String> command = new ArrayList<>();
        command.add(config.getSignerExecutable());
        command.add("--input");
        command.add(input.toAbsolutePath().toString());
        command.add("--output");
        command.add(output.toAbsolutePath().toString());
        command.add("--key");
        command.add(config.getPrivateKeyPath());
        if (StringUtils.hasText(config.getPrivateKeyPassword())) {
            command.add(PASSWORD_FLAG);
            command.add(config.getPrivateKeyPassword());
        }
        command.add("--verbose");
        return command;
    }

    static List<String> maskPassword(final List<String> command) {
        final List<String> masked = new ArrayList<>(command);
        final int flag = masked.indexOf(PASSWORD_FLAG);
        if (flag >= 0 && flag + 1 < masked.size()) {
            masked.set(flag + 1, MASK);
        }
        return masked;
    }

    private Map<String, String> buildEnvironment() {
        if (StringUtils.hasText(config.getGstPluginPath())) {
            return Map.of("GST_PLUGIN_PATH", config.getGstPluginPath());
        }
        return Map.of();
    }
}
