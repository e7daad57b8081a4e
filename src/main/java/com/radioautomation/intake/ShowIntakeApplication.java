package com.radioautomation.intake;

import com.radioautomation.intake.config.IntakeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Show Intake Engine.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.intake" properties to {@link IntakeProperties}.</li>
 *     <li>{@link EnableScheduling}: Activates background jobs such as stale processing recovery.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for the queue repositories.</li>
 *     <li>{@link EnableRetry}: Enables retries of transient I/O failures while writing output files.</li>
 * </ul>
 * The watchers themselves are started by {@link com.radioautomation.intake.service.intake.IntakeLifecycle}
 * once the context is ready.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.radioautomation.intake.repository")
@EnableConfigurationProperties(value = IntakeProperties.class)
@EnableRetry
public class ShowIntakeApplication {

    public static void main(final String[] args) {
        log.info("Starting ShowIntakeApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ShowIntakeApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ShowIntake"));
        log.info("  - Watch directory:  {}", env.getProperty("app.intake.global-watch-directory", "Watch"));
        log.info("  - Output directory: {}", env.getProperty("app.intake.default-output-directory", "Output"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
