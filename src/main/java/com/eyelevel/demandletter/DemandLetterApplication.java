package com.eyelevel.demandletter;

import com.eyelevel.demandletter.config.DemandLetterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the Demand Letter service.
 * <p>
 * Besides auto-configuration it binds the "app.processing" properties to {@link DemandLetterConfig}
 * and enables Spring Retry for the store's transient-failure retries.
 */
@Slf4j
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.demandletter.repository")
@EnableConfigurationProperties(value = DemandLetterConfig.class)
@EnableRetry
public class DemandLetterApplication {

    public static void main(final String[] args) {
        log.info("Starting DemandLetterApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DemandLetterApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DemandLetter"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
