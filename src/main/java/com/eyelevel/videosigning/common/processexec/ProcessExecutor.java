package com.eyelevel.videosigning.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * A safe limit for the amount of stdout/stderr to capture in memory.
     * 16 KB is enough to capture most error messages without risking OutOfMemoryError.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    /**
     * Upper bound for reaping a forcibly destroyed process and for draining its streams afterwards.
     */
    private static final long REAP_TIMEOUT_SECONDS = 10;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     * <p>
     * If the timeout elapses, the process and all of its descendants are forcibly destroyed and
     * reaped before this method returns, and the result is flagged as {@code timedOut}.
     *
     * @param command     The command and its arguments to execute.
     * @param environment Extra environment variables for the process; may be empty.
     * @param contextInfo A string for logging context (e.g., the job ID).
     * @param timeout     The maximum time to wait for the process to complete.
     * @param processName A descriptive name for the process (e.g., "signer").
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws IOException          if the process cannot be started.
     * @throws InterruptedException if the waiting thread is interrupted; the process tree is destroyed first.
     */
    public ProcessResult execute(List<String> command, Map<String, String> environment, String contextInfo,
                                 Duration timeout, String processName) throws IOException, InterruptedException {

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);
        Process process = builder.start();
        log.debug("[{}] Started {} process (pid {}).", contextInfo, processName, process.pid());

        StringBuffer stdoutCapture = new StringBuffer();
        StringBuffer stderrCapture = new StringBuffer();

        ExecutorService streamReaders = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, processName + "-stream-reader");
            thread.setDaemon(true);
            return thread;
        });
        boolean timedOut = false;
        try {
            // Drain both streams so the child never blocks on a full pipe.
            streamReaders.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            streamReaders.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                                                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo,
                                                                     processName, line)));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                timedOut = true;
                log.warn("[{}] {} process exceeded {}s. Destroying process tree.", contextInfo, processName,
                         timeout.toSeconds());
                destroyProcessTree(process, contextInfo, processName);
            }
        } catch (InterruptedException e) {
            destroyProcessTree(process, contextInfo, processName);
            throw e;
        } finally {
            streamReaders.shutdown();
            if (!streamReaders.awaitTermination(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[{}] {} output readers did not finish in time.", contextInfo, processName);
                streamReaders.shutdownNow();
            }
        }

        int exitCode = process.isAlive() ? -1 : process.exitValue();
        return new ProcessResult(exitCode, stdoutCapture.toString().trim(), stderrCapture.toString().trim(),
                                 timedOut);
    }

    private void destroyProcessTree(Process process, String contextInfo, String processName)
            throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        if (!process.waitFor(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.error("[{}] {} process (pid {}) did not terminate after being forcibly destroyed.", contextInfo,
                      processName, process.pid());
        }
    }

    /**
     * A Runnable that consumes an InputStream, captures its content up to a limit,
     * and optionally logs each line. This prevents both deadlocks and OutOfMemoryErrors.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                // The pipe closes under us when the process is destroyed.
                log.debug("Process stream closed while reading: {}", e.getMessage());
            }
        }
    }

    /**
     * A record to hold the result of an external process execution.
     *
     * @param exitCode The exit code of the process; meaningless when {@code timedOut} is true.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     * @param timedOut Whether the process was killed for exceeding its timeout.
     */
    public record ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {
    }
}
