package com.eyelevel.videosigning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Binds application properties under the "app.signing" prefix to a strongly-typed
 * configuration object. Built once at startup and injected wherever signing, staging
 * or validation settings are needed.
 */
@Data
@ConfigurationProperties(prefix = "app.signing")
public class VideoSigningConfig {

    /**
     * Location of the signed video framework shared library. Only checked for presence.
     */
    private String signedVideoLibPath = "/usr/local/lib/libsigned-video-framework.so";

    private String signerExecutable = "/usr/local/bin/signer";

    private String privateKeyPath = "/etc/video-signing/private.pem";

    /**
     * Optional passphrase for the private key. Never logged.
     */
    private String privateKeyPassword = "";

    /**
     * Appended to the signer's environment as GST_PLUGIN_PATH when set.
     */
    private String gstPluginPath;

    private String stagingDir = "/tmp/video-signing/staging";

    private String artifactDir = "/tmp/video-signing";

    private Duration timeout = Duration.ofSeconds(300);

    private int hashChunkSize = 4096;

    private boolean startupProbeEnabled = true;

    private Set<String> supportedFormats = new LinkedHashSet<>(Set.of("mp4", "mov", "avi", "mkv", "m4v"));

    private Worker worker = new Worker();

    @Data
    public static class Worker {
        private int poolSize = 2;
        private int queueCapacity = 50;
    }
}
