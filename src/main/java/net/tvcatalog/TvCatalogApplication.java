/**
 * Main application class for the TV catalog API
 *
 * Features:
 * - Read endpoints for shows, seasons, episodes, characters and actors
 * - Opaque-cursor (keyset) pagination shared by every list endpoint
 * - Disables SQL initialization; the schema is managed outside the service
 */

package net.tvcatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

@SpringBootApplication(exclude = {
    // Schema bootstrap is not this service's concern
    org.springframework.boot.jdbc.autoconfigure.DataSourceInitializationAutoConfiguration.class
})
public class TvCatalogApplication {

    private static final Logger log = LoggerFactory.getLogger(TvCatalogApplication.class);

    /**
     * Starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Path.of(".env"));
        SpringApplication.run(TvCatalogApplication.class, args);
    }

    /**
     * Copies {@code .env} entries into system properties unless the environment already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream is = Files.newInputStream(envFile)) {
            Properties props = new Properties();
            props.load(is);
            for (String key : props.stringPropertyNames()) {
                if (!StringUtils.hasText(System.getenv(key)) && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
            log.info("Loaded {} entr(ies) from {}", props.size(), envFile);
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
