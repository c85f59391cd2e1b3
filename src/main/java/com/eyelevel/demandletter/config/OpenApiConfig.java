package com.eyelevel.demandletter.config;

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
        String appName = buildProperties.map(BuildProperties::getName).orElse("Demand Letter API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Generates demand letters from a text template and a CSV data file.

                                * **Asynchronous Generation:** an upload returns a job ID at once; the document
                                  is produced by an external webhook in the background.
                                * **Polling:** clients poll the job status and download the letter once completed.
                                * **History:** filtered job history with per-status counts.
                                * **Chat:** messages are relayed to a chat webhook and every exchange is recorded.
                                """));
    }
}
