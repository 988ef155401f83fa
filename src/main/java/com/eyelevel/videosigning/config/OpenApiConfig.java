package com.eyelevel.videosigning.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Video Signing API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API accepts video uploads from client devices and signs them with an
                                external signing tool.

                                Key features include:
                                * **Asynchronous Signing:** Uploads are acknowledged immediately and signed in the background.
                                * **Integrity Tracking:** A SHA-256 content hash is recorded for every upload.
                                * **Status Monitoring:** Each job can be polled until it is completed or failed.
                                * **Artifact Retrieval:** Signed videos are downloadable once their job completes.
                                """));
    }
}
