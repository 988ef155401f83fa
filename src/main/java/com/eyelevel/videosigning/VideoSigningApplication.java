package com.eyelevel.videosigning;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Video Signing Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.signing" properties to {@link VideoSigningConfig}.</li>
 *     <li>{@link EnableScheduling}: Activates the stale job recovery scheduler.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for the job record repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.videosigning.repository")
@EnableConfigurationProperties(value = VideoSigningConfig.class)
public class VideoSigningApplication {

    public static void main(final String[] args) {
        log.info("Starting VideoSigningApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(VideoSigningApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "VideoSigning"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8000"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
